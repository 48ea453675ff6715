package com.coedit.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Kafka topic carrying every document's envelopes, keyed by document id.
     * Each instance reads it with its own consumer group and filters locally.
     */
    public static final String DOCUMENT_EVENTS = "coedit.document.events";

    /**
     * Consumer group prefix; the instance id is appended so that every instance sees every record.
     */
    public static final String INSTANCE_GROUP_PREFIX = "coedit-node-";

    public static String groupFor(String instanceId) {
        return INSTANCE_GROUP_PREFIX + instanceId;
    }
}
