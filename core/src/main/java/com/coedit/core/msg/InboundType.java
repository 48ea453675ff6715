package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed set of frame types a client may send.
 */
public enum InboundType {
    @JsonProperty("update")
    UPDATE,
    @JsonProperty("cursor")
    CURSOR,
    @JsonProperty("chat")
    CHAT,
    @JsonProperty("ping")
    PING
}
