package com.opsagent.tracker.config;

/**
 * Workspace and item type used when a caller does not name one. Either the key or the name
 * identifies the workspace; the key wins when both are set.
 */
public record WorkspaceDefaults(String workspaceKey, String workspaceName, String typeName) {

    public static final String FALLBACK_TYPE_NAME = "问题管理";

    public boolean hasWorkspace() {
        return (workspaceKey != null && !workspaceKey.isBlank())
                || (workspaceName != null && !workspaceName.isBlank());
    }
}
