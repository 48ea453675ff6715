package com.coedit.core.msg;

/**
 * A client frame could not be decoded or is missing a field its type requires.
 * Only the offending frame is dropped.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
