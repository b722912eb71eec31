package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Lists;
import com.opsagent.tracker.api.WorkItemApi;
import com.opsagent.tracker.config.ScanSettings;
import com.opsagent.tracker.dto.TaskPage;
import com.opsagent.tracker.dto.WorkItemFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Finds work items whose item type the caller does not know.
 *
 * The caller's type is tried first; the other types of the workspace are then queried concurrently in
 * fixed-size batches, and the first batch with a hit ends the search.
 */
@Service
public class CrossTypeLookupService {

    private static final Logger logger = LoggerFactory.getLogger(CrossTypeLookupService.class);
    private static final String NOT_FOUND_MARKER = "__NOT_FOUND__";
    private static final int NAME_SEARCH_PAGE_SIZE = 20;

    private final WorkItemApi workItemApi;
    private final MetadataCacheManager metadata;
    private final TaskExecutor taskExecutor;
    private final ScanSettings settings;
    private final Cache<Long, String> itemNames;

    public CrossTypeLookupService(WorkItemApi workItemApi,
                                  MetadataCacheManager metadata,
                                  @Qualifier("trackerTaskExecutor") TaskExecutor taskExecutor,
                                  ScanSettings settings,
                                  Ticker ticker) {
        this.workItemApi = workItemApi;
        this.metadata = metadata;
        this.taskExecutor = taskExecutor;
        this.settings = settings;
        this.itemNames = CacheBuilder.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    /**
     * A work item together with the item type it was found in.
     */
    public record LocatedItem(String typeKey, JsonNode item) {
    }

    public Optional<LocatedItem> findItem(String workspaceKey, String preferredTypeKey, long itemId) {
        try {
            List<JsonNode> items = workItemApi.query(workspaceKey, preferredTypeKey, List.of(itemId));
            if (!items.isEmpty()) {
                return Optional.of(new LocatedItem(preferredTypeKey, items.get(0)));
            }
        } catch (RuntimeException e) {
            logger.debug("Initial query failed for type {}: {}", preferredTypeKey, e.getMessage());
        }

        logger.info("Issue {} not found in its default type, searching the other item types", itemId);
        List<String> otherTypes = otherTypeKeys(workspaceKey, preferredTypeKey);
        for (List<String> batch : Lists.partition(otherTypes, settings.typeBatchSize())) {
            List<CompletableFuture<List<JsonNode>>> futures = new ArrayList<>();
            for (String typeKey : batch) {
                futures.add(queryQuietly(workspaceKey, typeKey, List.of(itemId)));
            }
            for (int i = 0; i < batch.size(); i++) {
                List<JsonNode> found = futures.get(i).join();
                if (!found.isEmpty()) {
                    logger.info("Issue {} found in item type {}", itemId, batch.get(i));
                    return Optional.of(new LocatedItem(batch.get(i), found.get(0)));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Names of related work items, best effort. Unknown ids are remembered as missing for a few
     * minutes and left out of the result.
     */
    public Map<Long, String> resolveItemNames(String workspaceKey, String preferredTypeKey, Collection<Long> itemIds) {
        Map<Long, String> names = new LinkedHashMap<>();
        Set<Long> remaining = new LinkedHashSet<>();
        for (Long id : itemIds) {
            String cached = itemNames.getIfPresent(id);
            if (cached == null) {
                remaining.add(id);
            } else if (!NOT_FOUND_MARKER.equals(cached)) {
                names.put(id, cached);
            }
        }
        if (remaining.isEmpty()) {
            return names;
        }

        try {
            collectNames(workItemApi.query(workspaceKey, preferredTypeKey, new ArrayList<>(remaining)), names, remaining);
        } catch (RuntimeException e) {
            logger.debug("Failed to fetch related items in the default type: {}", e.getMessage());
        }
        if (remaining.isEmpty()) {
            return names;
        }

        List<String> otherTypes;
        try {
            otherTypes = otherTypeKeys(workspaceKey, preferredTypeKey);
        } catch (RuntimeException e) {
            logger.warn("Failed to list item types for related item lookup: {}", e.getMessage());
            return names;
        }
        for (List<String> batch : Lists.partition(otherTypes, settings.typeBatchSize())) {
            if (remaining.isEmpty()) {
                break;
            }
            List<Long> wanted = new ArrayList<>(remaining);
            List<CompletableFuture<List<JsonNode>>> futures = new ArrayList<>();
            for (String typeKey : batch) {
                futures.add(queryQuietly(workspaceKey, typeKey, wanted));
            }
            for (CompletableFuture<List<JsonNode>> future : futures) {
                collectNames(future.join(), names, remaining);
            }
        }
        if (!remaining.isEmpty()) {
            logger.debug("Related items not found in any type: {}", remaining);
            remaining.forEach(id -> itemNames.put(id, NOT_FOUND_MARKER));
        }
        return names;
    }

    /**
     * Work item id for an id or a name. Names are searched across every item type of the workspace;
     * an exact name wins, otherwise the first partial match.
     */
    public long resolveRelatedTo(String workspaceKey, Object relatedTo) {
        Optional<Long> direct = FieldValueResolver.toItemId(relatedTo instanceof String text ? text.strip() : relatedTo);
        if (direct.isPresent()) {
            return direct.get();
        }
        if (!(relatedTo instanceof String name) || name.isBlank()) {
            throw new IllegalArgumentException("relatedTo must be a work item id or name, got " + relatedTo);
        }

        List<String> typeKeys = new ArrayList<>(metadata.listTypes(workspaceKey).values());
        WorkItemFilter filter = WorkItemFilter.builder()
                .workItemTypeKeys(typeKeys)
                .workItemName(name.strip())
                .pageNum(1)
                .pageSize(NAME_SEARCH_PAGE_SIZE)
                .build();
        TaskPage page = WorkItemPayloads.normalize(workItemApi.filter(workspaceKey, filter), 1, NAME_SEARCH_PAGE_SIZE);

        JsonNode partial = null;
        List<String> candidates = new ArrayList<>();
        for (JsonNode item : page.items()) {
            String itemName = item.path("name").asText("");
            Optional<Long> id = WorkItemPayloads.itemId(item);
            if (id.isEmpty()) {
                continue;
            }
            if (itemName.equals(name.strip())) {
                logger.info("Related item resolved by exact name (id {})", id.get());
                return id.get();
            }
            candidates.add(itemName);
            if (partial == null) {
                partial = item;
            }
        }
        if (partial != null) {
            long id = WorkItemPayloads.itemId(partial).orElseThrow();
            logger.info("Related item resolved by partial name match '{}' (id {})", partial.path("name").asText(), id);
            return id;
        }
        throw new MetadataNotFoundException(MetadataNotFoundException.Kind.WORK_ITEM, name, candidates);
    }

    public void clearItemNameCache() {
        itemNames.invalidateAll();
        logger.info("Cleared work item name cache");
    }

    public void invalidateItemName(long itemId) {
        itemNames.invalidate(itemId);
    }

    private List<String> otherTypeKeys(String workspaceKey, String excludedTypeKey) {
        List<String> others = new ArrayList<>();
        for (String typeKey : metadata.listTypes(workspaceKey).values()) {
            if (!typeKey.equals(excludedTypeKey)) {
                others.add(typeKey);
            }
        }
        return others;
    }

    private CompletableFuture<List<JsonNode>> queryQuietly(String workspaceKey, String typeKey, List<Long> ids) {
        return CompletableFuture
                .supplyAsync(() -> workItemApi.query(workspaceKey, typeKey, ids), taskExecutor)
                .handle((items, error) -> {
                    if (error != null) {
                        logger.debug("Query in item type {} failed: {}", typeKey, error.getMessage());
                        return List.<JsonNode>of();
                    }
                    return items;
                });
    }

    private void collectNames(List<JsonNode> items, Map<Long, String> names, Set<Long> remaining) {
        for (JsonNode item : items) {
            Optional<Long> id = WorkItemPayloads.itemId(item);
            if (id.isPresent()) {
                String name = item.path("name").asText("");
                names.put(id.get(), name);
                itemNames.put(id.get(), name);
                remaining.remove(id.get());
            }
        }
    }
}
