package com.coedit.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * {@code data} object of an update frame: the full document text after the edit.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentData {
    @JsonProperty("content")
    String content;

    @JsonCreator
    public ContentData(@JsonProperty("content") String content) {
        this.content = content;
    }
}
