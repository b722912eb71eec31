package com.opsagent.tracker.service;

import java.util.List;

/**
 * Heuristics for telling opaque user keys apart from names and emails.
 */
public final class UserIdentifiers {

    private static final List<String> KEY_PREFIXES = List.of("user_", "ou_", "usr_", "u_");

    private UserIdentifiers() {
    }

    /**
     * True when the identifier can be used as a user key without a directory search. Not a validation.
     */
    public static boolean looksLikeUserKey(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        for (String prefix : KEY_PREFIXES) {
            if (identifier.startsWith(prefix)) {
                return true;
            }
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isWhitespace(c) || (c >= '\u4e00' && c <= '\u9fff')) {
                return false;
            }
        }
        if (identifier.length() < 5 || identifier.length() > 100) {
            return false;
        }
        return identifier.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_' || c == '-');
    }
}
