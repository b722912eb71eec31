package com.opsagent.tracker.model;

/**
 * Outcome of one (work item, field) write attempt.
 */
public record UpdateResult(
        boolean success,
        long issueId,
        String fieldName,
        String message,
        Object attemptedValue
) {

    public static UpdateResult succeeded(long issueId, String fieldName, String message, Object attemptedValue) {
        return new UpdateResult(true, issueId, fieldName, message, attemptedValue);
    }

    public static UpdateResult failed(long issueId, String fieldName, String message, Object attemptedValue) {
        return new UpdateResult(false, issueId, fieldName, message, attemptedValue);
    }

    public UpdateResult withIssueId(long otherIssueId) {
        return new UpdateResult(success, otherIssueId, fieldName, message, attemptedValue);
    }
}
