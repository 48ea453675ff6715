package com.coedit.socket.session;

/**
 * Lifecycle of a {@link Session}.
 * <p>
 * The connecting phase (upgrade request, credential check) happens before a Session exists,
 * so a new Session starts {@link #AUTHENTICATED}.
 * </p>
 * <pre>
 * AUTHENTICATED -> JOINED -> ACTIVE -> DISCONNECTING -> CLOSED
 *        \__________\__________\______/
 * </pre>
 * Any state before DISCONNECTING may move to it, exactly once.
 */
public enum SessionState {
    AUTHENTICATED,
    JOINED,
    ACTIVE,
    DISCONNECTING,
    CLOSED;

    public boolean isTerminal() {
        return this == DISCONNECTING || this == CLOSED;
    }
}
