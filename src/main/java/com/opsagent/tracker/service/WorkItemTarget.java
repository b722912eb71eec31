package com.opsagent.tracker.service;

import com.opsagent.tracker.config.WorkspaceDefaults;
import com.opsagent.tracker.model.TypeScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The workspace and item type work item operations run against when the caller does not pick one.
 * Resolved once and then reused.
 */
@Component
public class WorkItemTarget {

    private static final Logger logger = LoggerFactory.getLogger(WorkItemTarget.class);

    private final MetadataCacheManager metadata;
    private final WorkspaceDefaults defaults;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile TypeScope resolved;

    public WorkItemTarget(MetadataCacheManager metadata, WorkspaceDefaults defaults) {
        this.metadata = metadata;
        this.defaults = defaults;
    }

    public TypeScope scope() {
        TypeScope current = resolved;
        if (current != null) {
            return current;
        }
        lock.lock();
        try {
            if (resolved == null) {
                String workspaceKey = workspaceKey();
                resolved = new TypeScope(workspaceKey, typeKey(workspaceKey));
            }
            return resolved;
        } finally {
            lock.unlock();
        }
    }

    public String workspaceKey() {
        if (!defaults.hasWorkspace()) {
            throw new IllegalStateException(
                    "No workspace configured: set tracker.workspace.default-key or tracker.workspace.default-name");
        }
        if (StringUtils.hasText(defaults.workspaceKey())) {
            return defaults.workspaceKey();
        }
        return metadata.resolveWorkspaceKey(defaults.workspaceName());
    }

    /**
     * Forgets the resolved scope, e.g. after the workspace schema changed.
     */
    public void reset() {
        resolved = null;
    }

    private String typeKey(String workspaceKey) {
        String typeName = StringUtils.hasText(defaults.typeName()) ? defaults.typeName() : WorkspaceDefaults.FALLBACK_TYPE_NAME;
        try {
            return metadata.resolveTypeKey(workspaceKey, typeName);
        } catch (MetadataNotFoundException e) {
            // only the built-in default may fall back; an explicitly configured type must exist
            if (!WorkspaceDefaults.FALLBACK_TYPE_NAME.equals(typeName)) {
                throw e;
            }
            Map<String, String> types = metadata.listTypes(workspaceKey);
            if (types.isEmpty()) {
                throw new MetadataNotFoundException(MetadataNotFoundException.Kind.ITEM_TYPE, typeName, e.getAlternatives());
            }
            Map.Entry<String, String> first = types.entrySet().iterator().next();
            logger.warn("Default item type '{}' does not exist, using '{}' instead", typeName, first.getKey());
            return first.getValue();
        }
    }
}
