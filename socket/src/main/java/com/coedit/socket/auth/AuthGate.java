package com.coedit.socket.auth;

import com.coedit.core.auth.AuthException;
import com.coedit.core.auth.Principal;
import com.coedit.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Runs before the WebSocket session exists. A rejected credential never allocates a session
 * or document state; the caller closes the connection with the error's reason.
 */
public class AuthGate {
    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);

    private final ITokenValidator validator;
    private final MetricsService metricsService;

    public AuthGate(ITokenValidator validator, MetricsService metricsService) {
        this.validator = validator;
        this.metricsService = metricsService;
    }

    /**
     * @param credential token from the query string or Authorization header, may be null
     * @return principal, or an {@link AuthException} error signal
     */
    public Mono<Principal> authenticate(String credential) {
        return Mono.fromCallable(() -> validator.authenticate(credential))
            .doOnNext(principal -> log.debug("Authenticated user {} ({})", principal.getUserId(), principal.getUsername()))
            .doOnError(AuthException.class, err -> {
                log.warn("Connection rejected: {}", err.getMessage());
                metricsService.recordAuthRejected(err.getError());
            });
    }
}
