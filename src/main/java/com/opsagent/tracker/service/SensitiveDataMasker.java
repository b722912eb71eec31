package com.opsagent.tracker.service;

import java.util.regex.Pattern;

/**
 * Hides opaque workspace and user keys in messages shown to callers.
 */
public final class SensitiveDataMasker {

    private static final Pattern WORKSPACE_KEY = Pattern.compile("project_[A-Za-z0-9_]+");
    private static final Pattern USER_KEY = Pattern.compile("user_[A-Za-z0-9_]+");
    private static final Pattern LONG_HEX = Pattern.compile("\\b[0-9a-fA-F]{32,}\\b");
    private static final String WORKSPACE_PREFIX = "project_";

    private SensitiveDataMasker() {
    }

    public static String maskIdentifiers(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String masked = WORKSPACE_KEY.matcher(message).replaceAll("project_***");
        masked = USER_KEY.matcher(masked).replaceAll("user_***");
        return LONG_HEX.matcher(masked).replaceAll("***");
    }

    /**
     * Keeps the first four characters of a workspace name or key.
     */
    public static String maskWorkspace(String nameOrKey) {
        if (nameOrKey == null || nameOrKey.isEmpty()) {
            return nameOrKey;
        }
        if (nameOrKey.startsWith(WORKSPACE_PREFIX)) {
            String rest = nameOrKey.substring(WORKSPACE_PREFIX.length());
            return WORKSPACE_PREFIX + rest.substring(0, Math.min(4, rest.length())) + "***";
        }
        if (nameOrKey.length() <= 4) {
            return nameOrKey + "***";
        }
        return nameOrKey.substring(0, 4) + "***";
    }
}
