package com.coedit.socket.session;

/**
 * Ends a session's outbound stream; the WebSocket is closed with {@link #getCloseCode()}.
 */
public class SessionTerminatedException extends RuntimeException {
    public static final int SLOW_CONSUMER = 1013;
    public static final int POLICY_VIOLATION = 1008;
    public static final int INTERNAL_ERROR = 1011;

    private final int closeCode;

    public SessionTerminatedException(int closeCode, String reason) {
        super(reason);
        this.closeCode = closeCode;
    }

    public int getCloseCode() {
        return closeCode;
    }
}
