package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.model.TrackerUser;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Service
public class UserApi {

    private final RemoteClient remoteClient;
    private final ObjectMapper objectMapper;

    public UserApi(RemoteClient remoteClient, ObjectMapper objectMapper) {
        this.remoteClient = remoteClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Free-text user search (name or email), optionally narrowed to one workspace.
     */
    public List<TrackerUser> searchUsers(String query, String workspaceKey) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        if (workspaceKey != null && !workspaceKey.isBlank()) {
            body.put("project_key", workspaceKey);
        }
        return toUsers(ApiResponses.requireSuccess(remoteClient.post("/open_api/user/search", body), "search users"));
    }

    public List<TrackerUser> queryUsers(Collection<String> userKeys) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("user_keys", objectMapper.valueToTree(userKeys));
        return toUsers(ApiResponses.requireSuccess(remoteClient.post("/open_api/user/query", body), "query users"));
    }

    private List<TrackerUser> toUsers(JsonNode data) {
        List<TrackerUser> users = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                users.add(objectMapper.convertValue(node, TrackerUser.class));
            }
        }
        return users;
    }
}
