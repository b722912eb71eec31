package com.opsagent.tracker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything known about the fields of one item type, loaded and replaced as a single unit:
 * name/alias to key, key to name, key to type, flattened options per field, and role name to role key.
 */
public final class FieldBundle {

    private final Map<String, String> nameToKey;
    private final Map<String, String> keyToName;
    private final Map<String, String> keyToType;
    private final Map<String, Map<String, String>> optionsByField;
    private final Map<String, String> roles;

    public FieldBundle(Map<String, String> nameToKey,
                       Map<String, String> keyToName,
                       Map<String, String> keyToType,
                       Map<String, Map<String, String>> optionsByField,
                       Map<String, String> roles) {
        this.nameToKey = freeze(nameToKey);
        this.keyToName = freeze(keyToName);
        this.keyToType = freeze(keyToType);
        Map<String, Map<String, String>> options = new LinkedHashMap<>();
        optionsByField.forEach((key, labels) -> options.put(key, freeze(labels)));
        this.optionsByField = Collections.unmodifiableMap(options);
        this.roles = freeze(roles);
    }

    public static FieldBundle empty() {
        return new FieldBundle(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public Map<String, String> nameToKey() {
        return nameToKey;
    }

    public Map<String, String> keyToName() {
        return keyToName;
    }

    public String typeOf(String fieldKey) {
        return keyToType.get(fieldKey);
    }

    public boolean isKnownKey(String fieldKey) {
        return nameToKey.containsValue(fieldKey) || keyToType.containsKey(fieldKey);
    }

    /**
     * Label to value for the given field; empty for fields without options.
     */
    public Map<String, String> options(String fieldKey) {
        return optionsByField.getOrDefault(fieldKey, Map.of());
    }

    public Map<String, String> roles() {
        return roles;
    }

    private static Map<String, String> freeze(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
