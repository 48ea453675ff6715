package com.coedit.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the instance identifier.
     */
    public static final String INSTANCE_ID = "instance_id";

    /**
     * Tag key for outcome or operation type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for delivery source (local/remote).
     */
    public static final String SOURCE = "source";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";
}
