package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.model.ItemType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MetadataApi {

    private final RemoteClient remoteClient;
    private final ObjectMapper objectMapper;

    public MetadataApi(RemoteClient remoteClient, ObjectMapper objectMapper) {
        this.remoteClient = remoteClient;
        this.objectMapper = objectMapper;
    }

    public List<ItemType> getItemTypes(String workspaceKey) {
        JsonNode data = ApiResponses.requireSuccess(
                remoteClient.get("/open_api/" + workspaceKey + "/work_item/all-types"), "list item types");
        List<ItemType> types = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                ItemType type = objectMapper.convertValue(node, ItemType.class);
                if (type.name() != null && type.typeKey() != null) {
                    types.add(type);
                }
            }
        }
        return types;
    }
}
