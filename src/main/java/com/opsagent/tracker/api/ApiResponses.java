package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.opsagent.tracker.client.RemoteResponse;

import java.util.Set;

/**
 * Shared success check for every accessor.
 */
final class ApiResponses {

    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(429, 10429);

    private ApiResponses() {
    }

    /**
     * Returns the {@code data} node of a successful response.
     *
     * @throws ThrottledException   when the response is rate-limit shaped
     * @throws TrackerApiException  on any other 4xx or non-zero embedded code
     */
    static JsonNode requireSuccess(RemoteResponse response, String operation) {
        if (response.isSuccess()) {
            return response.data();
        }
        int code = response.errorCode();
        String message = RemoteErrorMessages.describe(response.json());
        if (response.httpStatus() == 429 || RATE_LIMIT_CODES.contains(code) || RemoteErrorMessages.looksRateLimited(message)) {
            throw new ThrottledException(operation + " throttled (HTTP " + response.httpStatus() + "): " + message,
                    response.httpStatus());
        }
        throw new TrackerApiException(operation, response.httpStatus(), code, message);
    }

    /**
     * Same check, but keeps the whole envelope so callers can read top-level pagination.
     */
    static JsonNode requireSuccessEnvelope(RemoteResponse response, String operation) {
        requireSuccess(response, operation);
        return response.json();
    }
}
