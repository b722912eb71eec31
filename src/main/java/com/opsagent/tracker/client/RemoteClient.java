package com.opsagent.tracker.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes requests against the work-tracking open API. Implementations inject auth headers and
 * retry transport failures (timeouts, connection errors, 5xx); application-level errors are returned
 * to the caller inside {@link RemoteResponse}.
 */
public interface RemoteClient {

    RemoteResponse request(String method, String path, JsonNode body);

    default RemoteResponse get(String path) {
        return request("GET", path, null);
    }

    default RemoteResponse post(String path, JsonNode body) {
        return request("POST", path, body);
    }

    default RemoteResponse put(String path, JsonNode body) {
        return request("PUT", path, body);
    }

    default RemoteResponse delete(String path) {
        return request("DELETE", path, null);
    }
}
