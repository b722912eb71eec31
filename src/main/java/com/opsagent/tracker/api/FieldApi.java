package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.model.FieldDefinition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class FieldApi {

    private final RemoteClient remoteClient;
    private final ObjectMapper objectMapper;

    public FieldApi(RemoteClient remoteClient, ObjectMapper objectMapper) {
        this.remoteClient = remoteClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Full field schema of one item type, options included.
     */
    public List<FieldDefinition> getAllFields(String workspaceKey, String typeKey) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("work_item_type_key", typeKey);
        JsonNode data = ApiResponses.requireSuccess(
                remoteClient.post("/open_api/" + workspaceKey + "/field/all", body), "list fields");
        List<FieldDefinition> fields = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                fields.add(objectMapper.convertValue(node, FieldDefinition.class));
            }
        }
        return fields;
    }
}
