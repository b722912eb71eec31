package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.api.WorkItemApi;
import com.opsagent.tracker.dto.IssueUpdateRequest;
import com.opsagent.tracker.dto.TaskPage;
import com.opsagent.tracker.dto.TaskQuery;
import com.opsagent.tracker.dto.WorkItemFilter;
import com.opsagent.tracker.model.FieldValue;
import com.opsagent.tracker.model.TypeScope;
import com.opsagent.tracker.model.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Work item operations against the default workspace and item type.
 */
@Service
public class WorkItemService {

    private static final Logger logger = LoggerFactory.getLogger(WorkItemService.class);
    static final List<String> OWNER_FIELD_CANDIDATES = List.of("owner", "当前负责人", "负责人", "经办人", "Assignee");
    private static final List<String> DISPLAY_FIELDS = List.of("priority", "status", "owner");

    private final WorkItemTarget target;
    private final MetadataCacheManager metadata;
    private final FieldValueResolver valueResolver;
    private final UpdateOrchestrator orchestrator;
    private final CrossTypeLookupService crossTypeLookup;
    private final RelationScanService relationScan;
    private final ReadableItemEnricher enricher;
    private final WorkItemApi workItemApi;
    private final ObjectMapper objectMapper;

    public WorkItemService(WorkItemTarget target,
                           MetadataCacheManager metadata,
                           FieldValueResolver valueResolver,
                           UpdateOrchestrator orchestrator,
                           CrossTypeLookupService crossTypeLookup,
                           RelationScanService relationScan,
                           ReadableItemEnricher enricher,
                           WorkItemApi workItemApi,
                           ObjectMapper objectMapper) {
        this.target = target;
        this.metadata = metadata;
        this.valueResolver = valueResolver;
        this.orchestrator = orchestrator;
        this.crossTypeLookup = crossTypeLookup;
        this.relationScan = relationScan;
        this.enricher = enricher;
        this.workItemApi = workItemApi;
        this.objectMapper = objectMapper;
    }

    // ---- listing ----

    public TaskPage getTasks(TaskQuery query) {
        TypeScope scope = target.scope();
        Long relatedTo = StringUtils.hasText(query.getRelatedTo())
                ? crossTypeLookup.resolveRelatedTo(scope.workspaceKey(), query.getRelatedTo())
                : null;

        if (query.hasOnlyRelation()) {
            return relationScan.scan(scope.workspaceKey(), scope.typeKey(), relatedTo);
        }
        if (StringUtils.hasText(query.getNameKeyword())) {
            return filterByName(scope, query, relatedTo);
        }
        return searchByParams(scope, query, relatedTo);
    }

    private TaskPage filterByName(TypeScope scope, TaskQuery query, Long relatedTo) {
        logger.info("Using filter endpoint for name keyword search");
        WorkItemFilter.WorkItemFilterBuilder filter = WorkItemFilter.builder()
                .workItemTypeKeys(List.of(scope.typeKey()))
                .workItemName(query.getNameKeyword())
                .pageNum(query.getPageNum())
                .pageSize(query.getPageSize());

        if (hasItems(query.getStatus())) {
            Optional<String> statusKey = metadata.findFieldKey(scope.workspaceKey(), scope.typeKey(), "status");
            if (statusKey.isPresent()) {
                List<String> statuses = query.getStatus().stream()
                        .map(status -> valueResolver.resolveFilterValue(scope, statusKey.get(), status))
                        .collect(Collectors.toList());
                filter.workItemStatus(statuses);
            } else {
                logger.warn("Status field not available, ignoring status filter");
            }
        }
        if (hasItems(query.getPriority()) || StringUtils.hasText(query.getOwner()) || relatedTo != null) {
            logger.info("Priority, owner and relation filters are applied after retrieval");
        }
        List<String> displayKeys = displayFieldKeys(scope);
        if (!displayKeys.isEmpty()) {
            filter.fields(displayKeys);
        }

        TaskPage page = WorkItemPayloads.normalize(
                workItemApi.filter(scope.workspaceKey(), filter.build()), query.getPageNum(), query.getPageSize());
        if (!hasItems(query.getPriority()) && !StringUtils.hasText(query.getOwner()) && relatedTo == null) {
            return page;
        }

        Optional<String> ownerKey = StringUtils.hasText(query.getOwner()) ? resolveOwnerQuietly(query.getOwner()) : Optional.empty();
        List<JsonNode> kept = new ArrayList<>();
        for (JsonNode item : page.items()) {
            if (hasItems(query.getPriority())) {
                Optional<String> priority = WorkItemPayloads.extractFieldValue(item, "priority");
                if (priority.isEmpty() || !query.getPriority().contains(priority.get())) {
                    continue;
                }
            }
            if (StringUtils.hasText(query.getOwner()) && !ownedBy(item, query.getOwner(), ownerKey)) {
                continue;
            }
            if (relatedTo != null && !WorkItemPayloads.isRelatedTo(item, relatedTo)) {
                continue;
            }
            kept.add(item);
        }
        logger.info("{} items left after client-side filtering", kept.size());
        return page.withItems(kept);
    }

    private boolean ownedBy(JsonNode item, String owner, Optional<String> ownerKey) {
        Optional<String> itemOwner = WorkItemPayloads.extractFieldValue(item, "owner");
        if (itemOwner.isEmpty() || ownerKey.isEmpty()) {
            return true;
        }
        return itemOwner.get().equals(ownerKey.get())
                || itemOwner.get().toLowerCase(Locale.ROOT).contains(owner.toLowerCase(Locale.ROOT));
    }

    private TaskPage searchByParams(TypeScope scope, TaskQuery query, Long relatedTo) {
        ArrayNode conditions = objectMapper.createArrayNode();
        if (hasItems(query.getStatus())) {
            optionCondition(scope, "status", query.getStatus()).ifPresent(conditions::add);
        }
        if (hasItems(query.getPriority())) {
            optionCondition(scope, "priority", query.getPriority()).ifPresent(conditions::add);
        }
        if (StringUtils.hasText(query.getOwner())) {
            ownerCondition(scope, query.getOwner()).ifPresent(conditions::add);
        }

        ObjectNode searchGroup = objectMapper.createObjectNode();
        searchGroup.put("conjunction", "AND");
        searchGroup.set("search_params", conditions);
        searchGroup.putArray("search_groups");
        logger.info("Querying tasks with {} conditions, page {} size {}", conditions.size(), query.getPageNum(), query.getPageSize());

        boolean filtered = hasItems(query.getStatus()) || hasItems(query.getPriority())
                || StringUtils.hasText(query.getOwner()) || relatedTo != null;
        List<String> fields = filtered ? displayFieldKeys(scope) : List.of();

        TaskPage page = WorkItemPayloads.normalize(
                workItemApi.searchByParams(scope.workspaceKey(), scope.typeKey(), searchGroup,
                        query.getPageNum(), query.getPageSize(), fields),
                query.getPageNum(), query.getPageSize());
        if (relatedTo == null) {
            return page;
        }
        long related = relatedTo;
        List<JsonNode> kept = page.items().stream()
                .filter(item -> WorkItemPayloads.isRelatedTo(item, related))
                .collect(Collectors.toList());
        logger.info("{} items left after relation filtering", kept.size());
        return page.withItems(kept);
    }

    private Optional<ObjectNode> optionCondition(TypeScope scope, String fieldName, List<String> values) {
        Optional<String> fieldKey = metadata.findFieldKey(scope.workspaceKey(), scope.typeKey(), fieldName);
        if (fieldKey.isEmpty()) {
            logger.warn("Field '{}' not found, skipping filter", fieldName);
            return Optional.empty();
        }
        ObjectNode condition = objectMapper.createObjectNode();
        condition.put("field_key", fieldKey.get());
        condition.put("operator", "IN");
        ArrayNode resolved = condition.putArray("value");
        values.forEach(value -> resolved.add(valueResolver.resolveFilterValue(scope, fieldKey.get(), value)));
        logger.info("Added {} filter: {}", fieldName, values);
        return Optional.of(condition);
    }

    private Optional<ObjectNode> ownerCondition(TypeScope scope, String owner) {
        Optional<String> userKey = resolveOwnerQuietly(owner);
        if (userKey.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode condition = objectMapper.createObjectNode();
        condition.put("field_key", ownerFieldKey(scope));
        condition.put("operator", "IN");
        condition.putArray("value").add(userKey.get());
        return Optional.of(condition);
    }

    String ownerFieldKey(TypeScope scope) {
        for (String candidate : OWNER_FIELD_CANDIDATES) {
            Optional<String> key = metadata.findFieldKey(scope.workspaceKey(), scope.typeKey(), candidate);
            if (key.isPresent()) {
                logger.debug("Owner field resolved to {} ('{}')", key.get(), candidate);
                return key.get();
            }
        }
        return "owner";
    }

    private Optional<String> resolveOwnerQuietly(String owner) {
        try {
            return Optional.of(metadata.resolveUserKey(owner));
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve owner, skipping owner filter: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> displayFieldKeys(TypeScope scope) {
        Set<String> keys = new LinkedHashSet<>();
        for (String name : DISPLAY_FIELDS) {
            metadata.findFieldKey(scope.workspaceKey(), scope.typeKey(), name).ifPresent(keys::add);
        }
        return new ArrayList<>(keys);
    }

    // ---- create / read / delete ----

    /**
     * Creates a work item. Description and owner go in with the create call; the priority is set by a
     * follow-up write whose failure is only logged.
     */
    public long createIssue(String name, String priority, String description, String assignee) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Work item name must not be empty");
        }
        TypeScope scope = target.scope();
        logger.info("Creating work item in type {}", scope.typeKey());

        ArrayNode fields = objectMapper.createArrayNode();
        if (StringUtils.hasText(description)) {
            ObjectNode field = fields.addObject();
            field.put("field_key", metadata.resolveFieldKey(scope.workspaceKey(), scope.typeKey(), "description"));
            field.put("field_value", description);
        }
        if (StringUtils.hasText(assignee)) {
            ObjectNode field = fields.addObject();
            field.put("field_key", "owner");
            field.put("field_value", metadata.resolveUserKey(assignee, scope.workspaceKey()));
        }

        JsonNode created = workItemApi.create(scope.workspaceKey(), scope.typeKey(), name, fields);
        long issueId = WorkItemPayloads.extractCreatedId(created)
                .orElseThrow(() -> new IllegalStateException("Create call returned no work item id"));

        if (StringUtils.hasText(priority)) {
            applyPriority(scope, issueId, priority);
        }
        return issueId;
    }

    private void applyPriority(TypeScope scope, long issueId, String priority) {
        try {
            String fieldKey = metadata.resolveFieldKey(scope.workspaceKey(), scope.typeKey(), "priority");
            FieldValue value = valueResolver.resolveForUpdate(scope, fieldKey, "priority", priority);
            ArrayNode update = objectMapper.createArrayNode();
            ObjectNode field = update.addObject();
            field.put("field_key", fieldKey);
            field.set("field_value", value.toWire(objectMapper));
            logger.info("Setting priority of new work item {}", issueId);
            workItemApi.update(scope.workspaceKey(), scope.typeKey(), issueId, update);
        } catch (RuntimeException e) {
            logger.warn("Failed to set priority for work item {}: {}", issueId, e.getMessage());
        }
    }

    /**
     * Raw work item. Falls back to searching every other item type of the workspace.
     */
    public JsonNode getIssueDetails(long issueId) {
        TypeScope scope = target.scope();
        return crossTypeLookup.findItem(scope.workspaceKey(), scope.typeKey(), issueId)
                .map(CrossTypeLookupService.LocatedItem::item)
                .orElseThrow(() -> new MetadataNotFoundException(MetadataNotFoundException.Kind.WORK_ITEM,
                        Long.toString(issueId), List.of()));
    }

    public ObjectNode getReadableIssueDetails(long issueId) {
        TypeScope scope = target.scope();
        CrossTypeLookupService.LocatedItem located = crossTypeLookup.findItem(scope.workspaceKey(), scope.typeKey(), issueId)
                .orElseThrow(() -> new MetadataNotFoundException(MetadataNotFoundException.Kind.WORK_ITEM,
                        Long.toString(issueId), List.of()));
        return enricher.enrich(located.item(), new TypeScope(scope.workspaceKey(), located.typeKey()));
    }

    public void deleteIssue(long issueId) {
        TypeScope scope = target.scope();
        workItemApi.delete(scope.workspaceKey(), scope.typeKey(), issueId);
        crossTypeLookup.invalidateItemName(issueId);
        logger.info("Deleted work item {}", issueId);
    }

    // ---- updates ----

    public List<UpdateResult> updateIssue(long issueId, IssueUpdateRequest request) {
        return batchUpdateIssues(List.of(issueId), request);
    }

    public List<UpdateResult> batchUpdateIssues(List<Long> issueIds, IssueUpdateRequest request) {
        TypeScope scope = target.scope();
        List<UpdateResult> results = orchestrator.batchUpdate(scope, issueIds, request.toFieldEdits());
        long failed = results.stream().filter(result -> !result.success()).count();
        if (failed > 0) {
            logger.warn("{} of {} field updates failed", failed, results.size());
        }
        return results;
    }

    // ---- metadata passthroughs ----

    /**
     * Option label to value for one field of the default item type.
     */
    public Map<String, String> listAvailableOptions(String fieldName) {
        TypeScope scope = target.scope();
        String fieldKey = metadata.resolveFieldKey(scope.workspaceKey(), scope.typeKey(), fieldName);
        return metadata.listOptions(scope.workspaceKey(), scope.typeKey(), fieldKey);
    }

    public long resolveRelatedTo(String relatedTo) {
        return crossTypeLookup.resolveRelatedTo(target.scope().workspaceKey(), relatedTo);
    }

    public void clearUserCache() {
        metadata.invalidateUsers();
    }

    public void clearWorkItemCache() {
        crossTypeLookup.clearItemNameCache();
    }

    public void clearAllCaches() {
        metadata.clearAll();
        crossTypeLookup.clearItemNameCache();
        target.reset();
    }

    private static boolean hasItems(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
