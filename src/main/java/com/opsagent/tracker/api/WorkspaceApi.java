package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Service
public class WorkspaceApi {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceApi.class);

    private final RemoteClient remoteClient;
    private final ObjectMapper objectMapper;
    private final String userKey;

    public WorkspaceApi(RemoteClient remoteClient,
                        ObjectMapper objectMapper,
                        @Value("${tracker.api.user-key:}") String userKey) {
        this.remoteClient = remoteClient;
        this.objectMapper = objectMapper;
        this.userKey = userKey;
    }

    /**
     * Keys of every workspace visible to the configured user.
     */
    public List<String> listWorkspaceKeys() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("user_key", userKey);
        body.put("tenant_group_id", 0);
        JsonNode data = ApiResponses.requireSuccess(remoteClient.post("/open_api/projects", body), "list workspaces");

        List<String> keys = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(node -> {
                if (node.isValueNode() && !node.asText().isBlank()) {
                    keys.add(node.asText());
                }
            });
        }
        logger.debug("Listed {} workspace keys", keys.size());
        return keys;
    }

    /**
     * Name and key of each requested workspace. The detail endpoint answers with a map keyed by
     * workspace key; older deployments answer with a list carrying {@code project_key}.
     */
    public List<Workspace> getWorkspaceDetails(Collection<String> workspaceKeys) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("project_keys", objectMapper.valueToTree(workspaceKeys));
        body.put("user_key", userKey);
        body.put("tenant_group_id", 0);
        JsonNode data = ApiResponses.requireSuccess(remoteClient.post("/open_api/projects/detail", body), "get workspace details");

        List<Workspace> workspaces = new ArrayList<>();
        if (data.isObject()) {
            data.fields().forEachRemaining(entry -> {
                String name = entry.getValue().path("name").asText("");
                if (!name.isBlank()) {
                    workspaces.add(new Workspace(name, entry.getKey()));
                }
            });
        } else if (data.isArray()) {
            logger.warn("Workspace details returned a list, indexing by project_key");
            for (JsonNode node : data) {
                String key = node.path("project_key").asText("");
                String name = node.path("name").asText("");
                if (!key.isBlank() && !name.isBlank()) {
                    workspaces.add(new Workspace(name, key));
                }
            }
        } else {
            logger.warn("Unexpected workspace details payload: {}", data.getNodeType());
        }
        return workspaces;
    }
}
