package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.opsagent.tracker.dto.TaskPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Readers for the loosely shaped work item payloads.
 */
public final class WorkItemPayloads {

    private static final Logger logger = LoggerFactory.getLogger(WorkItemPayloads.class);

    private WorkItemPayloads() {
    }

    /**
     * Accepts a bare item list or a {@code {work_items, pagination}} object.
     */
    public static TaskPage normalize(JsonNode result, int pageNum, int pageSize) {
        List<JsonNode> items = new ArrayList<>();
        if (result != null && result.isArray()) {
            result.forEach(items::add);
            return new TaskPage(items, items.size(), pageNum, pageSize, null);
        }
        if (result != null && result.isObject()) {
            result.path("work_items").forEach(items::add);
            JsonNode pagination = result.path("pagination");
            if (pagination.isObject()) {
                return new TaskPage(items,
                        pagination.path("total").asLong(items.size()),
                        pagination.path("page_num").asInt(pageNum),
                        pagination.path("page_size").asInt(pageSize),
                        null);
            }
            return new TaskPage(items, result.path("total").asLong(items.size()), pageNum, pageSize, null);
        }
        logger.warn("Unexpected work item result: {}", result == null ? null : result.getNodeType());
        return new TaskPage(items, 0, pageNum, pageSize, null);
    }

    /**
     * Readable value of one field, looked up in {@code fields} first and {@code field_value_pairs} second.
     */
    public static Optional<String> extractFieldValue(JsonNode item, String fieldKey) {
        for (String container : List.of("fields", "field_value_pairs")) {
            for (JsonNode field : item.path(container)) {
                if (fieldKey.equals(field.path("field_key").asText(null))) {
                    return parseRawValue(field.path("field_value"));
                }
            }
        }
        logger.debug("Field key '{}' not found in item {}", fieldKey, item.path("id").asText());
        return Optional.empty();
    }

    static Optional<String> parseRawValue(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        if (value.isObject()) {
            return firstText(value, "label", "value");
        }
        if (value.isArray()) {
            if (value.size() > 0 && value.get(0).isObject()) {
                return firstText(value.get(0), "name", "name_cn");
            }
            return value.size() == 0 ? Optional.empty() : Optional.of(value.toString());
        }
        String text = value.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * True when any field value of the item is, or contains, the given work item id.
     */
    public static boolean isRelatedTo(JsonNode item, long relatedId) {
        for (JsonNode field : item.path("fields")) {
            JsonNode value = field.path("field_value");
            if (value.isArray()) {
                for (JsonNode element : value) {
                    if (sameId(element, relatedId)) {
                        return true;
                    }
                }
            } else if (sameId(value, relatedId)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameId(JsonNode node, long id) {
        if (node.isIntegralNumber()) {
            return node.asLong() == id;
        }
        return node.isTextual() && node.asText().equals(Long.toString(id));
    }

    /**
     * The create endpoint answers with an id, an object carrying {@code id}, or a list of those.
     */
    public static Optional<Long> extractCreatedId(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return Optional.empty();
        }
        if (data.isIntegralNumber()) {
            return Optional.of(data.asLong());
        }
        if (data.isArray()) {
            return data.size() == 0 ? Optional.empty() : extractCreatedId(data.get(0).isObject() ? data.get(0).path("id") : data.get(0));
        }
        if (data.isObject()) {
            return extractCreatedId(data.path("id"));
        }
        return data.isTextual() ? parseId(data.asText()) : Optional.empty();
    }

    public static Optional<Long> itemId(JsonNode item) {
        JsonNode id = item.path("id");
        if (id.isIntegralNumber()) {
            return Optional.of(id.asLong());
        }
        return id.isTextual() ? parseId(id.asText()) : Optional.empty();
    }

    /**
     * Item id written as digits. Empty for anything else, including values past {@code Long.MAX_VALUE}.
     */
    public static Optional<Long> parseId(String text) {
        if (text == null || text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            logger.debug("Id '{}' does not fit a long", text);
            return Optional.empty();
        }
    }

    private static Optional<String> firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isEmpty()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }
}
