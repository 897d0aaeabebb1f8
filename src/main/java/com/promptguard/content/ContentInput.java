package com.promptguard.content;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * A record pulled from the ingestion pipeline. Only {@code body} is screened by
 * the default path; the other fields identify the content in events.
 */
public record ContentInput(
        String body,
        String title,
        String description,
        String contentId,
        String sourceId
) {
    @JsonCreator
    public ContentInput {
    }

    public ContentInput(String body) {
        this(body, null, null, null, null);
    }

    public String bodyOrEmpty() {
        return body != null ? body : "";
    }
}
