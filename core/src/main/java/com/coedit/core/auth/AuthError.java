package com.coedit.core.auth;

/**
 * Why a credential was refused. The reason string is sent to the client in the close frame.
 */
public enum AuthError {
    MISSING("Missing token"),
    INVALID("Invalid token"),
    EXPIRED("Token expired");

    private final String reason;

    AuthError(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
