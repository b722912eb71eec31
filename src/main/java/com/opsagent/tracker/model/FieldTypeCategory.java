package com.opsagent.tracker.model;

import java.util.Locale;

/**
 * Groups the remote field type keys by the shape their values take on the write API.
 */
public enum FieldTypeCategory {
    TEXT,
    BOOL,
    SELECT,
    MULTI_SELECT,
    USER,
    MULTI_USER,
    RELATED_ITEM,
    RELATED_ITEMS,
    ROLE_OWNERS,
    OTHER;

    public static FieldTypeCategory of(String typeKey) {
        if (typeKey == null) {
            return OTHER;
        }
        switch (typeKey.toLowerCase(Locale.ROOT)) {
            case "text":
            case "textarea":
            case "name":
            case "multi_text":
            case "rich_text":
                return TEXT;
            case "bool":
                return BOOL;
            case "select":
            case "single_select":
            case "radio":
            case "tree_select":
                return SELECT;
            case "multi_select":
            case "tree_multi_select":
                return MULTI_SELECT;
            case "user":
            case "owner":
            case "creator":
            case "modifier":
                return USER;
            case "multi_user":
                return MULTI_USER;
            case "work_item_related_select":
                return RELATED_ITEM;
            case "work_item_related_multi_select":
                return RELATED_ITEMS;
            case "role_owners":
                return ROLE_OWNERS;
            default:
                return OTHER;
        }
    }

    /**
     * Field types whose value may be cleared with a blank input. Everything else skips blanks.
     */
    public static boolean acceptsBlank(String typeKey) {
        return "text".equals(typeKey) || "textarea".equals(typeKey) || "name".equals(typeKey);
    }

    public boolean isUserValued() {
        return this == USER || this == MULTI_USER || this == ROLE_OWNERS;
    }

    public boolean isRelation() {
        return this == RELATED_ITEM || this == RELATED_ITEMS;
    }
}
