package com.opsagent.tracker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional user snapshot: identifiers (names, emails, already-known keys) to user key, and
 * user key to display name. Additions produce a new directory.
 */
public final class UserDirectory {

    private static final UserDirectory EMPTY = new UserDirectory(Map.of(), Map.of());

    private final Map<String, String> identifierToKey;
    private final Map<String, String> keyToName;

    private UserDirectory(Map<String, String> identifierToKey, Map<String, String> keyToName) {
        this.identifierToKey = Collections.unmodifiableMap(new LinkedHashMap<>(identifierToKey));
        this.keyToName = Collections.unmodifiableMap(new LinkedHashMap<>(keyToName));
    }

    public static UserDirectory empty() {
        return EMPTY;
    }

    public Optional<String> keyFor(String identifier) {
        return Optional.ofNullable(identifierToKey.get(identifier));
    }

    public Optional<String> nameFor(String userKey) {
        String name = keyToName.get(userKey);
        if (name != null) {
            return Optional.of(name);
        }
        // Identifiers mapped onto themselves are keys, not names.
        return identifierToKey.entrySet().stream()
                .filter(entry -> entry.getValue().equals(userKey) && !entry.getKey().equals(userKey))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public boolean contains(String identifier) {
        return identifierToKey.containsKey(identifier);
    }

    public int size() {
        return identifierToKey.size();
    }

    public UserDirectory withIdentifier(String identifier, String userKey) {
        Map<String, String> identifiers = new LinkedHashMap<>(identifierToKey);
        identifiers.put(identifier, userKey);
        return new UserDirectory(identifiers, keyToName);
    }

    /**
     * Registers the user under its display name and email, and remembers the display name for the key.
     */
    public UserDirectory withUser(TrackerUser user) {
        if (user == null || user.userKey() == null || user.userKey().isBlank()) {
            return this;
        }
        Map<String, String> identifiers = new LinkedHashMap<>(identifierToKey);
        Map<String, String> names = new LinkedHashMap<>(keyToName);
        String displayName = user.displayName();
        if (displayName != null) {
            identifiers.put(displayName, user.userKey());
            names.put(user.userKey(), displayName);
        }
        if (user.email() != null && !user.email().isBlank()) {
            identifiers.put(user.email(), user.userKey());
        }
        return new UserDirectory(identifiers, names);
    }
}
