package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Client-side "related to" filtering. The remote query language has no relation operator, so pages
 * of one item type are fetched a few at a time and their field values inspected locally.
 */
@Service
public class RelationScanService {

    private static final Logger logger = LoggerFactory.getLogger(RelationScanService.class);
    private static final int LOW_YIELD_SCANNED = 200;
    private static final int LOW_YIELD_FOUND = 5;

    private final WorkItemApi workItemApi;
    private final TaskExecutor taskExecutor;
    private final ScanSettings settings;

    public RelationScanService(WorkItemApi workItemApi,
                               @Qualifier("trackerTaskExecutor") TaskExecutor taskExecutor,
                               ScanSettings settings) {
        this.workItemApi = workItemApi;
        this.taskExecutor = taskExecutor;
        this.settings = settings;
    }

    public TaskPage scan(String workspaceKey, String typeKey, long relatedTo) {
        logger.warn("Scanning work items client-side for relation to {}; add name, status or priority filters to narrow it",
                relatedTo);

        List<JsonNode> found = new ArrayList<>();
        int fetched = 0;
        int currentPage = 1;

        while (fetched < settings.maxTotalItems() && currentPage <= settings.maxPages()) {
            int endPage = Math.min(currentPage + settings.concurrentPages(), settings.maxPages() + 1);
            List<CompletableFuture<PageOutcome>> futures = new ArrayList<>();
            for (int page = currentPage; page < endPage; page++) {
                futures.add(fetchPage(workspaceKey, typeKey, page));
            }
            logger.info("Fetching pages {} to {} concurrently", currentPage, endPage - 1);

            boolean endOfData = false;
            boolean failed = false;
            int batchCount = 0;
            for (CompletableFuture<PageOutcome> future : futures) {
                PageOutcome outcome = future.join();
                if (outcome.error() != null) {
                    logger.error("Failed to fetch page {}: {}", outcome.pageNum(), outcome.error().getMessage());
                    failed = true;
                    continue;
                }
                List<JsonNode> items = outcome.items();
                batchCount += items.size();
                fetched += items.size();
                for (JsonNode item : items) {
                    if (WorkItemPayloads.isRelatedTo(item, relatedTo)) {
                        found.add(item);
                    }
                }
                if (items.size() < settings.pageSize()) {
                    endOfData = true;
                }
            }
            logger.debug("Pages {}-{}: {} items, {} related so far", currentPage, endPage - 1, batchCount, found.size());

            if (endOfData) {
                break;
            }
            if (failed) {
                logger.warn("Stopping scan after page errors so no page is silently skipped");
                break;
            }
            currentPage = endPage;
        }

        logger.info("Scanned {} items, found {} related to {}", fetched, found.size(), relatedTo);
        if (fetched > LOW_YIELD_SCANNED && found.size() < LOW_YIELD_FOUND) {
            logger.warn("Low yield: scanned {} items but found only {} related items", fetched, found.size());
        }

        String hint = String.format("Found %d items related to %d (scanned %d items, max %d). "
                        + "To search more items, add name_keyword, status, or priority filters.",
                found.size(), relatedTo, fetched, settings.maxTotalItems());
        return new TaskPage(found, found.size(), 1, found.size(), hint);
    }

    private CompletableFuture<PageOutcome> fetchPage(String workspaceKey, String typeKey, int pageNum) {
        WorkItemFilter filter = WorkItemFilter.builder()
                .workItemTypeKeys(List.of(typeKey))
                .pageNum(pageNum)
                .pageSize(settings.pageSize())
                .build();
        return CompletableFuture
                .supplyAsync(() -> WorkItemPayloads.normalize(workItemApi.filter(workspaceKey, filter), pageNum, settings.pageSize()),
                        taskExecutor)
                .handle((page, error) -> error == null
                        ? new PageOutcome(pageNum, page.items(), null)
                        : new PageOutcome(pageNum, List.of(), unwrap(error)));
    }

    private static Throwable unwrap(Throwable error) {
        return error.getCause() != null && error instanceof CompletionException
                ? error.getCause() : error;
    }

    private record PageOutcome(int pageNum, List<JsonNode> items, Throwable error) {
    }
}
