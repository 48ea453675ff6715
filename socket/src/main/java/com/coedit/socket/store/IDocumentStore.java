package com.coedit.socket.store;

import reactor.core.publisher.Mono;

/**
 * Durable document storage collaborator.
 */
public interface IDocumentStore {
    /**
     * Loads the stored content.
     *
     * @param documentId Document identifier
     * @return content, or empty if the document does not exist
     */
    Mono<String> get(String documentId);

    /**
     * Overwrites the stored content.
     *
     * @param documentId Document identifier
     * @param content    Full document text
     * @return Mono completing when durable, or erroring with {@link PersistenceException}
     */
    Mono<Void> put(String documentId, String content);
}
