package com.opsagent.tracker.dto;

/**
 * Keys resolved in one pass from human names: workspace, item type, field and optionally an option value.
 */
public record ResolvedFieldPath(String workspaceKey, String typeKey, String fieldKey, String optionValue) {
}
