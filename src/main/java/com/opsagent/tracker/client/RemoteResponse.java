package com.opsagent.tracker.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Raw outcome of one remote call: the HTTP status plus the parsed JSON body.
 */
public record RemoteResponse(int httpStatus, JsonNode json) {

    public RemoteResponse {
        json = json == null ? MissingNode.getInstance() : json;
    }

    /**
     * Embedded status code; the remote API reports failures here even on HTTP 200.
     */
    public int errorCode() {
        JsonNode code = json.path("err_code");
        if (code.isMissingNode() || code.isNull()) {
            code = json.path("code");
        }
        return code.isMissingNode() || code.isNull() ? 0 : code.asInt(-1);
    }

    public boolean isSuccess() {
        return httpStatus >= 200 && httpStatus < 300 && errorCode() == 0;
    }

    public JsonNode data() {
        return json.path("data");
    }
}
