package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import com.opsagent.tracker.api.RemoteErrorMessages;
import com.opsagent.tracker.api.ThrottledException;
import com.opsagent.tracker.api.TrackerApiException;
import com.opsagent.tracker.api.WorkItemApi;
import com.opsagent.tracker.config.UpdateSettings;
import com.opsagent.tracker.dto.FieldEdit;
import com.opsagent.tracker.dto.ResolvedField;
import com.opsagent.tracker.model.FieldTypeCategory;
import com.opsagent.tracker.model.FieldValue;
import com.opsagent.tracker.model.TypeScope;
import com.opsagent.tracker.model.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Applies field edits to one or more work items.
 *
 * Edits are resolved once per batch. A single item gets one optimistic compound write; if that fails
 * for any reason, and always for several items, every (item, field) pair is written separately behind
 * a global write limiter, with backoff retries on rate limiting only. Failures come back as results.
 */
@Service
public class UpdateOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(UpdateOrchestrator.class);
    private static final long POST_WRITE_PAUSE_MS = 100L;
    private static final long MAX_BACKOFF_MS = 30_000L;

    private final MetadataCacheManager metadata;
    private final FieldValueResolver fieldValueResolver;
    private final WorkItemApi workItemApi;
    private final ObjectMapper objectMapper;
    private final TaskExecutor taskExecutor;
    private final RateLimiter writeRateLimiter;
    private final UpdateSettings settings;
    private final Semaphore writePermits;

    public UpdateOrchestrator(MetadataCacheManager metadata,
                              FieldValueResolver fieldValueResolver,
                              WorkItemApi workItemApi,
                              ObjectMapper objectMapper,
                              @Qualifier("trackerTaskExecutor") TaskExecutor taskExecutor,
                              @Qualifier("writeRateLimiter") RateLimiter writeRateLimiter,
                              UpdateSettings settings) {
        this.metadata = metadata;
        this.fieldValueResolver = fieldValueResolver;
        this.workItemApi = workItemApi;
        this.objectMapper = objectMapper;
        this.taskExecutor = taskExecutor;
        this.writeRateLimiter = writeRateLimiter;
        this.settings = settings;
        this.writePermits = new Semaphore(settings.maxConcurrentWrites(), true);
    }

    /**
     * Field resolution outcome for a batch: what can be written, and what already failed.
     */
    public record Resolution(List<ResolvedField> resolved, List<UpdateResult> failures) {
    }

    /**
     * One result per (item, field).
     *
     * @throws IllegalArgumentException     when nothing is left to write and nothing failed
     * @throws NoResolvableFieldsException  when every requested field failed to resolve
     */
    public List<UpdateResult> batchUpdate(TypeScope scope, List<Long> issueIds, List<FieldEdit> edits) {
        if (issueIds == null || issueIds.isEmpty()) {
            return List.of();
        }
        Resolution resolution = resolveEdits(scope, issueIds.get(0), edits);

        List<UpdateResult> results = new ArrayList<>();
        for (Long issueId : issueIds) {
            for (UpdateResult failure : resolution.failures()) {
                results.add(failure.withIssueId(issueId));
            }
        }
        if (resolution.resolved().isEmpty()) {
            if (results.isEmpty()) {
                throw new IllegalArgumentException("No fields to update");
            }
            throw new NoResolvableFieldsException(results);
        }

        if (issueIds.size() == 1) {
            Optional<List<UpdateResult>> optimistic = tryCompoundUpdate(scope, issueIds.get(0), resolution.resolved());
            if (optimistic.isPresent()) {
                results.addAll(optimistic.get());
                return results;
            }
        }

        List<CompletableFuture<UpdateResult>> futures = new ArrayList<>();
        for (Long issueId : issueIds) {
            for (ResolvedField field : resolution.resolved()) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> performSingleFieldUpdate(scope, issueId, field), taskExecutor)
                        .handle((result, error) -> error == null ? result
                                : UpdateResult.failed(issueId, field.fieldName(),
                                "Failed to update field '" + field.fieldName() + "': " + SensitiveDataMasker.maskIdentifiers(rootMessage(error)),
                                field.value().display())));
            }
        }
        logger.info("Running {} individual update tasks", futures.size());
        for (CompletableFuture<UpdateResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Resolves names and values for every edit. Unknown extra fields and resolution errors turn
     * into failed results against {@code issueId}; blank values on non-text fields are skipped.
     */
    public Resolution resolveEdits(TypeScope scope, long issueId, List<FieldEdit> edits) {
        List<ResolvedField> resolved = new ArrayList<>();
        List<UpdateResult> failures = new ArrayList<>();

        for (FieldEdit edit : edits) {
            Object value = edit.value() instanceof String text ? text.strip() : edit.value();
            try {
                if (edit.custom() && metadata.findFieldKey(scope.workspaceKey(), scope.typeKey(), edit.fieldName()).isEmpty()) {
                    failures.add(UpdateResult.failed(issueId, edit.fieldName(),
                            "Field '" + edit.fieldName() + "' does not exist", value));
                    continue;
                }
                String fieldKey = edit.fixedKey() != null ? edit.fixedKey()
                        : metadata.resolveFieldKey(scope.workspaceKey(), scope.typeKey(), edit.fieldName());

                if ("name".equals(fieldKey)) {
                    resolved.add(new ResolvedField(edit.fieldName(), fieldKey, new FieldValue.Scalar(value)));
                    continue;
                }

                String fieldType = metadata.resolveFieldType(scope.workspaceKey(), scope.typeKey(), fieldKey).orElse(null);
                boolean blank = value == null || (value instanceof String text && text.isEmpty());
                if (blank && !FieldTypeCategory.acceptsBlank(fieldType)
                        && FieldTypeCategory.of(fieldType) != FieldTypeCategory.MULTI_SELECT) {
                    logger.info("Skipping empty value for non-text field '{}'", edit.fieldName());
                    continue;
                }

                FieldValue fieldValue = fieldValueResolver.resolveForUpdate(scope, fieldKey, edit.fieldName(), value);
                resolved.add(new ResolvedField(edit.fieldName(), fieldKey, fieldValue));
            } catch (RuntimeException e) {
                logger.warn("Failed to resolve field '{}': {}", edit.fieldName(), e.getMessage());
                failures.add(UpdateResult.failed(issueId, edit.fieldName(),
                        "Field resolution failed: " + SensitiveDataMasker.maskIdentifiers(e.getMessage()), value));
            }
        }
        return new Resolution(resolved, failures);
    }

    private Optional<List<UpdateResult>> tryCompoundUpdate(TypeScope scope, long issueId, List<ResolvedField> fields) {
        logger.info("Optimistic compound update for issue {} ({} fields)", issueId, fields.size());
        try {
            writeUnderPermit(scope, issueId, fields);
        } catch (ThrottledException te) {
            logger.warn("Optimistic update hit rate limit, falling back to individual updates");
            return Optional.empty();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted during optimistic update of issue {}, falling back", issueId);
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Optimistic update failed for issue {}: {}. Falling back to individual updates",
                    issueId, e.getMessage());
            return Optional.empty();
        }

        List<UpdateResult> results = new ArrayList<>();
        for (ResolvedField field : fields) {
            results.add(UpdateResult.succeeded(issueId, field.fieldName(), "Updated", field.value().display()));
        }
        return Optional.of(results);
    }

    UpdateResult performSingleFieldUpdate(TypeScope scope, long issueId, ResolvedField field) {
        Object attempted = field.value().display();
        int maxRetries = settings.maxRetries();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                writeUnderPermit(scope, issueId, List.of(field));
                return UpdateResult.succeeded(issueId, field.fieldName(),
                        "Field '" + field.fieldName() + "' updated", attempted);
            } catch (ThrottledException te) {
                if (attempt < maxRetries) {
                    long delay = backoffMillis(attempt);
                    logger.warn("Rate limit hit updating issue {} field '{}'. Retrying in {} ms (attempt {}/{})",
                            issueId, field.fieldName(), delay, attempt + 1, maxRetries);
                    if (!sleep(delay)) {
                        return UpdateResult.failed(issueId, field.fieldName(), "Interrupted while waiting to retry", attempted);
                    }
                    continue;
                }
                logger.error("Rate limit persisted for issue {} field '{}'", issueId, field.fieldName());
                return UpdateResult.failed(issueId, field.fieldName(),
                        "Failed to update field '" + field.fieldName() + "': rate limited after " + maxRetries + " retries", attempted);
            } catch (TrackerApiException e) {
                logger.error("Failed to update issue {} field '{}': {}", issueId, field.fieldName(), e.getMessage());
                return UpdateResult.failed(issueId, field.fieldName(),
                        "Failed to update field '" + field.fieldName() + "': " + SensitiveDataMasker.maskIdentifiers(RemoteErrorMessages.forUpdate(e.getRemoteMessage())),
                        attempted);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return UpdateResult.failed(issueId, field.fieldName(), "Interrupted while waiting for a write slot", attempted);
            } catch (RuntimeException e) {
                logger.error("Failed to update issue {} field '{}': {}", issueId, field.fieldName(), e.getMessage());
                return UpdateResult.failed(issueId, field.fieldName(),
                        "Failed to update field '" + field.fieldName() + "': " + SensitiveDataMasker.maskIdentifiers(RemoteErrorMessages.forUpdate(e.getMessage())),
                        attempted);
            }
        }
        return UpdateResult.failed(issueId, field.fieldName(), "Retries exhausted", attempted);
    }

    private void writeUnderPermit(TypeScope scope, long issueId, List<ResolvedField> fields) throws InterruptedException {
        ArrayNode payload = objectMapper.createArrayNode();
        for (ResolvedField field : fields) {
            ObjectNode entry = payload.addObject();
            entry.put("field_key", field.fieldKey());
            entry.set("field_value", field.value().toWire(objectMapper));
        }

        writePermits.acquire();
        try {
            writeRateLimiter.acquire();
            workItemApi.update(scope.workspaceKey(), scope.typeKey(), issueId, payload);
            if (fields.size() == 1) {
                sleep(POST_WRITE_PAUSE_MS);
            }
        } finally {
            writePermits.release();
        }
    }

    // base * 2^attempt plus up to one base of jitter
    private long backoffMillis(int attempt) {
        long base = settings.baseBackoffMs();
        long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1L, base));
        return (long) Math.min(MAX_BACKOFF_MS, base * Math.pow(2, attempt) + jitter);
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
