package com.coedit.core.redis;

/**
 * Redis keyspace and pub/sub channel names.
 * <p>
 * Namespaced prefixes ({@code doc:}, {@code user:}, {@code document:}) keep the editor's keys
 * apart from anything else sharing the instance.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Durable document: {@code doc:{documentId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code content}, {@code updatedAt} (epoch millis of the last flush)
     * </p>
     *
     * @param documentId Document identifier
     * @return Redis key
     */
    public static String doc(String documentId) {
        return "doc:" + documentId;
    }

    /**
     * User profile: {@code user:{userId}}
     * <p>
     * <b>Type:</b> Hash with a {@code username} field
     * </p>
     *
     * @param userId User identifier
     * @return Redis key
     */
    public static String user(String userId) {
        return "user:" + userId;
    }

    /**
     * Pub/sub channel carrying envelopes for one document: {@code document:{documentId}}
     *
     * @param documentId Document identifier
     * @return channel name
     */
    public static String documentChannel(String documentId) {
        return "document:" + documentId;
    }
}
