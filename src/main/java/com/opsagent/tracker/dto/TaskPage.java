package com.opsagent.tracker.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Normalised page of work items, whatever envelope the server answered with. {@code hint} is only set
 * by client-side scans.
 */
public record TaskPage(List<JsonNode> items, long total, int pageNum, int pageSize, String hint) {

    public TaskPage {
        items = List.copyOf(items);
    }

    public TaskPage withItems(List<JsonNode> filtered) {
        return new TaskPage(filtered, total, pageNum, pageSize, hint);
    }
}
