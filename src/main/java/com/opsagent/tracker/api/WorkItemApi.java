package com.opsagent.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.client.RemoteClient;
import com.opsagent.tracker.dto.WorkItemFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * One method per work item endpoint. Nothing here resolves names; callers pass keys and ids.
 */
@Service
public class WorkItemApi {

    private static final Logger logger = LoggerFactory.getLogger(WorkItemApi.class);

    private final RemoteClient remoteClient;
    private final ObjectMapper objectMapper;

    public WorkItemApi(RemoteClient remoteClient, ObjectMapper objectMapper) {
        this.remoteClient = remoteClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a work item and returns the raw {@code data} node, which may be a number, an object
     * or a list depending on the server version.
     */
    public JsonNode create(String workspaceKey, String typeKey, String name, ArrayNode fieldValuePairs) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("work_item_type_key", typeKey);
        body.put("name", name);
        body.set("field_value_pairs", fieldValuePairs == null ? objectMapper.createArrayNode() : fieldValuePairs);
        logger.info("Creating work item of type {} in workspace", typeKey);
        return ApiResponses.requireSuccess(
                remoteClient.post(workItemPath(workspaceKey) + "/create", body), "create work item");
    }

    public List<JsonNode> query(String workspaceKey, String typeKey, Collection<Long> itemIds) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("work_item_ids", objectMapper.valueToTree(itemIds));
        body.putObject("expand").put("need_workflow", false);
        JsonNode data = ApiResponses.requireSuccess(
                remoteClient.post(workItemPath(workspaceKey) + "/" + typeKey + "/query", body), "query work items");
        List<JsonNode> items = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(items::add);
        }
        return items;
    }

    /**
     * @param updateFields array of {@code {field_key, field_value}} objects
     */
    public void update(String workspaceKey, String typeKey, long itemId, ArrayNode updateFields) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("update_fields", updateFields);
        ApiResponses.requireSuccess(
                remoteClient.put(workItemPath(workspaceKey) + "/" + typeKey + "/" + itemId, body), "update work item");
    }

    public void delete(String workspaceKey, String typeKey, long itemId) {
        ApiResponses.requireSuccess(
                remoteClient.delete(workItemPath(workspaceKey) + "/" + typeKey + "/" + itemId), "delete work item");
    }

    /**
     * Filter endpoint. Returns either a bare item list or {@code {work_items, pagination}}.
     */
    public JsonNode filter(String workspaceKey, WorkItemFilter filter) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("work_item_type_keys", objectMapper.valueToTree(filter.getWorkItemTypeKeys()));
        body.put("page_num", filter.getPageNum());
        body.put("page_size", filter.getPageSize());
        if (filter.getWorkItemName() != null && !filter.getWorkItemName().isBlank()) {
            body.put("work_item_name", filter.getWorkItemName());
        }
        if (filter.getWorkItemStatus() != null && !filter.getWorkItemStatus().isEmpty()) {
            body.set("work_item_status", objectMapper.valueToTree(filter.getWorkItemStatus()));
        }
        if (filter.getFields() != null && !filter.getFields().isEmpty()) {
            body.set("fields", objectMapper.valueToTree(filter.getFields()));
        }
        JsonNode envelope = ApiResponses.requireSuccessEnvelope(
                remoteClient.post(workItemPath(workspaceKey) + "/filter", body), "filter work items");
        return withPagination(envelope);
    }

    /**
     * Parameterised search within one item type.
     */
    public JsonNode searchByParams(String workspaceKey, String typeKey, ObjectNode searchGroup,
                                   int pageNum, int pageSize, List<String> fields) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("search_group", searchGroup);
        body.put("page_num", pageNum);
        body.put("page_size", pageSize);
        if (fields != null && !fields.isEmpty()) {
            body.set("fields", objectMapper.valueToTree(fields));
        }
        JsonNode envelope = ApiResponses.requireSuccessEnvelope(
                remoteClient.post(workItemPath(workspaceKey) + "/" + typeKey + "/search/params", body), "search work items");
        return withPagination(envelope);
    }

    private JsonNode withPagination(JsonNode envelope) {
        JsonNode data = envelope.path("data");
        JsonNode pagination = envelope.get("pagination");
        if (pagination == null || !pagination.isObject() || !data.isArray()) {
            return data;
        }
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.set("work_items", data);
        wrapped.set("pagination", pagination);
        return wrapped;
    }

    private static String workItemPath(String workspaceKey) {
        return "/open_api/" + workspaceKey + "/work_item";
    }
}
