package com.opsagent.tracker.service;

import org.springframework.stereotype.Component;

/**
 * Option values look like {@code role_<workspace>_<type>_role_a06e00}; the short key is the last
 * {@code role_<suffix>} pair.
 */
@Component
public class SuffixRoleKeyExtractor implements RoleKeyExtractor {

    private static final String PREFIX = "role_";

    @Override
    public String extract(String optionValue) {
        String[] parts = optionValue.split("_", -1);
        if (parts.length >= 2 && "role".equals(parts[parts.length - 2])) {
            return PREFIX + parts[parts.length - 1];
        }
        if (optionValue.startsWith(PREFIX)) {
            return optionValue;
        }
        String suffix = parts[parts.length - 1];
        return suffix.startsWith("role") ? suffix : PREFIX + suffix;
    }
}
