package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Frame sent to clients. Absent fields are omitted from the JSON.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerMessage {
    @JsonProperty("type")
    OutboundType type;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("username")
    String username;

    @JsonProperty("active_users")
    List<String> activeUsers;

    @JsonProperty("content")
    String content;

    @JsonProperty("data")
    ContentData data;

    @JsonProperty("message")
    String message;

    @JsonProperty("position")
    JsonNode position;

    @JsonProperty("selection")
    JsonNode selection;

    @JsonProperty("timestamp")
    Long timestamp;

    @JsonCreator
    public ServerMessage(
        @JsonProperty("type") OutboundType type,
        @JsonProperty("user_id") String userId,
        @JsonProperty("username") String username,
        @JsonProperty("active_users") List<String> activeUsers,
        @JsonProperty("content") String content,
        @JsonProperty("data") ContentData data,
        @JsonProperty("message") String message,
        @JsonProperty("position") JsonNode position,
        @JsonProperty("selection") JsonNode selection,
        @JsonProperty("timestamp") Long timestamp
    ) {
        this.type = type;
        this.userId = userId;
        this.username = username;
        this.activeUsers = activeUsers;
        this.content = content;
        this.data = data;
        this.message = message;
        this.position = position;
        this.selection = selection;
        this.timestamp = timestamp;
    }

    public static ServerMessage init(String userId, String username, List<String> activeUsers, String content) {
        return ServerMessage.builder()
            .type(OutboundType.INIT)
            .userId(userId)
            .username(username)
            .activeUsers(List.copyOf(activeUsers))
            .content(content)
            .build();
    }

    public static ServerMessage update(String userId, String username, String content, long timestamp) {
        return ServerMessage.builder()
            .type(OutboundType.UPDATE)
            .userId(userId)
            .username(username)
            .data(new ContentData(content))
            .timestamp(timestamp)
            .build();
    }

    public static ServerMessage cursor(String userId, String username, JsonNode position, JsonNode selection) {
        return ServerMessage.builder()
            .type(OutboundType.CURSOR)
            .userId(userId)
            .username(username)
            .position(position)
            .selection(selection)
            .build();
    }

    public static ServerMessage chat(String userId, String username, String message, long timestamp) {
        return ServerMessage.builder()
            .type(OutboundType.CHAT)
            .userId(userId)
            .username(username)
            .message(message)
            .timestamp(timestamp)
            .build();
    }

    public static ServerMessage userJoined(String userId, String username) {
        return new ServerMessage(OutboundType.USER_JOINED, userId, username,
            null, null, null, null, null, null, null);
    }

    public static ServerMessage userLeft(String userId, String username) {
        return new ServerMessage(OutboundType.USER_LEFT, userId, username,
            null, null, null, null, null, null, null);
    }
}
