package com.coedit.socket.store;

import reactor.core.publisher.Mono;

/**
 * User Directory collaborator.
 */
public interface IUserDirectory {
    /**
     * @param userId User identifier
     * @return display name, or empty if the user has no profile
     */
    Mono<String> resolve(String userId);
}
