package com.coedit.core.auth;

import lombok.Value;

/**
 * Authenticated identity extracted from an access token.
 */
@Value
public class Principal {
    String userId;

    /**
     * Display name claimed by the token; falls back to the user id when the claim is absent.
     */
    String username;
}
