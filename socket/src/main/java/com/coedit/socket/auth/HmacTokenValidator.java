package com.coedit.socket.auth;

import com.coedit.core.auth.AccessToken;
import com.coedit.core.auth.Principal;

import java.time.Clock;

/**
 * Validates HS256 access tokens signed with the cluster-wide secret.
 */
public class HmacTokenValidator implements ITokenValidator {
    private final String secret;
    private final Clock clock;

    public HmacTokenValidator(String secret, Clock clock) {
        this.secret = secret;
        this.clock = clock;
    }

    public HmacTokenValidator(String secret) {
        this(secret, Clock.systemUTC());
    }

    @Override
    public Principal authenticate(String credential) {
        return AccessToken.verify(credential, secret, clock.instant());
    }
}
