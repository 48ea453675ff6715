package com.coedit.socket.session;

import lombok.Value;

import java.util.List;

/**
 * Outcome of handing one frame to a document's local sessions.
 */
@Value
public class DeliveryResult {
    public static final DeliveryResult NONE = new DeliveryResult(0, List.of());

    int delivered;

    /**
     * Sessions whose outbound queue refused the frame.
     */
    List<Session> failed;
}
