package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Frame types the server sends to clients. Everything except {@link #INIT} may also
 * travel between instances inside an {@link Envelope}.
 */
public enum OutboundType {
    @JsonProperty("init")
    INIT,
    @JsonProperty("update")
    UPDATE,
    @JsonProperty("cursor")
    CURSOR,
    @JsonProperty("chat")
    CHAT,
    @JsonProperty("user_joined")
    USER_JOINED,
    @JsonProperty("user_left")
    USER_LEFT
}
