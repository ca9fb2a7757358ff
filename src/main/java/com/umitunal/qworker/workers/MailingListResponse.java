package com.umitunal.qworker.workers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Status and body of a mailing list API call.
 */
public final class MailingListResponse {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int statusCode;
    private final String body;

    public MailingListResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * The {@code title} of a JSON error body, or null when the body has none.
     */
    public String errorTitle() {
        try {
            JsonNode title = MAPPER.readTree(body).get("title");
            return title == null || title.isNull() ? null : title.asText();
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "MailingListResponse{status=" + statusCode + ", body='" + body + "'}";
    }
}
