package com.opsagent.tracker.service;

import com.opsagent.tracker.model.UpdateResult;

import java.util.List;

/**
 * Every requested field failed to resolve, so no write was attempted. The per-field failures are attached.
 */
public class NoResolvableFieldsException extends RuntimeException {

    private final List<UpdateResult> results;

    public NoResolvableFieldsException(List<UpdateResult> results) {
        super("None of the requested fields could be resolved (" + results.size() + " failures)");
        this.results = List.copyOf(results);
    }

    public List<UpdateResult> getResults() {
        return results;
    }
}
