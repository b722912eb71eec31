package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Turns the remote error envelope into one readable line.
 */
public final class RemoteErrorMessages {

    static final String LOCKED_FIELD_HINT = " (field may be locked by workflow, read-only or lacking permission)";

    private RemoteErrorMessages() {
    }

    /**
     * Combines the top-level {@code err_msg}/{@code msg} with the nested {@code err.msg}/{@code err.err_msg}.
     */
    public static String describe(JsonNode json) {
        if (json == null || json.isMissingNode() || json.isNull()) {
            return "unknown error";
        }
        String apiMessage = firstText(json, "err_msg", "msg");
        JsonNode inner = json.path("err");
        String innerMessage = inner.isObject() ? firstText(inner, "msg", "err_msg") : null;

        if (apiMessage != null && innerMessage != null && !apiMessage.equals(innerMessage)) {
            return apiMessage + ": " + innerMessage;
        }
        if (innerMessage != null) {
            return innerMessage;
        }
        if (apiMessage != null) {
            return apiMessage;
        }
        return "unknown error";
    }

    /**
     * Drops request URLs and flags the wording the server uses for locked fields.
     */
    public static String forUpdate(String detail) {
        if (detail == null) {
            return "unknown error";
        }
        String cleaned = detail;
        int urlAt = cleaned.indexOf("for url");
        if (urlAt >= 0) {
            cleaned = cleaned.substring(0, urlAt).trim();
        }
        if (cleaned.contains("is illegal") && !cleaned.endsWith(LOCKED_FIELD_HINT)) {
            cleaned = cleaned + LOCKED_FIELD_HINT;
        }
        return cleaned;
    }

    public static boolean looksRateLimited(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return (message.contains("429") && lower.contains("too many requests")) || lower.contains("rate limit");
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
