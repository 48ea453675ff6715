package com.coedit.socket.auth;

import com.coedit.core.auth.AuthException;
import com.coedit.core.auth.Principal;

/**
 * Token Validator collaborator: turns a connection credential into a principal.
 */
public interface ITokenValidator {
    /**
     * @param credential raw credential supplied by the client, may be null
     * @return authenticated principal
     * @throws AuthException when the credential is missing, invalid or expired
     */
    Principal authenticate(String credential);
}
