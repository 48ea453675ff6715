package com.coedit.core.auth;

public class AuthException extends RuntimeException {
    private final AuthError error;

    public AuthException(AuthError error) {
        super(error.reason());
        this.error = error;
    }

    public AuthException(AuthError error, Throwable cause) {
        super(error.reason(), cause);
        this.error = error;
    }

    public AuthError getError() {
        return error;
    }
}
