package com.opsagent.tracker.dto;

/**
 * One requested field change, as the caller named it.
 *
 * @param fieldName display name (or alias, or key) used for lookup and in results
 * @param value     human value: text, number, boolean, option label, list, or role map
 * @param fixedKey  field key to use without a lookup, e.g. {@code name} or {@code owner}
 * @param custom    caller-supplied extra field; must exist in the schema
 */
public record FieldEdit(String fieldName, Object value, String fixedKey, boolean custom) {

    public static FieldEdit of(String fieldName, Object value) {
        return new FieldEdit(fieldName, value, null, false);
    }

    public static FieldEdit withKey(String fieldName, Object value, String fixedKey) {
        return new FieldEdit(fieldName, value, fixedKey, false);
    }

    public static FieldEdit custom(String fieldName, Object value) {
        return new FieldEdit(fieldName, value, null, true);
    }
}
