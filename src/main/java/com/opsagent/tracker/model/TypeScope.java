package com.opsagent.tracker.model;

/**
 * Cache key for everything scoped to one item type inside one workspace.
 */
public record TypeScope(String workspaceKey, String typeKey) {
}
