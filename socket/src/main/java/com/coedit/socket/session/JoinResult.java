package com.coedit.socket.session;

import lombok.Value;

import java.util.List;

/**
 * Snapshot handed to a session at join time.
 */
@Value
public class JoinResult {
    DocumentRoom room;

    /**
     * User ids of the sessions that were already present on this instance.
     */
    List<String> activeUsers;

    String content;
}
