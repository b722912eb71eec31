package com.opsagent.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsagent.tracker.model.FieldTypeCategory;
import com.opsagent.tracker.model.TypeScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adds human-readable names to a raw work item: every field gets a {@code field_name}, and a
 * {@code readable_fields} object maps field names to labels, user names and related item names.
 * Lookups are best effort; anything that cannot be named keeps its raw value.
 */
@Component
public class ReadableItemEnricher {

    private static final Logger logger = LoggerFactory.getLogger(ReadableItemEnricher.class);
    private static final List<String> ROOT_USER_KEYS = List.of("owner", "created_by", "updated_by");
    private static final List<String> USER_FIELD_KEYS = List.of("owner", "creator", "modifier", "assignee", "created_by", "updated_by");
    private static final List<String> TOP_LEVEL_ALIASES = List.of("owner", "creator", "updater", "assignee");
    private static final String UNKNOWN_TYPE = "unknown";

    private final MetadataCacheManager metadata;
    private final CrossTypeLookupService crossTypeLookup;
    private final ObjectMapper objectMapper;

    public ReadableItemEnricher(MetadataCacheManager metadata, CrossTypeLookupService crossTypeLookup, ObjectMapper objectMapper) {
        this.metadata = metadata;
        this.crossTypeLookup = crossTypeLookup;
        this.objectMapper = objectMapper;
    }

    public ObjectNode enrich(JsonNode item, TypeScope fallbackScope) {
        ObjectNode enhanced = item.isObject() ? ((ObjectNode) item).deepCopy() : objectMapper.createObjectNode();
        TypeScope scope = new TypeScope(
                item.path("project_key").asText(fallbackScope.workspaceKey()),
                item.path("work_item_type_key").asText(fallbackScope.typeKey()));

        ArrayNode fields = normalizedFields(item);
        Set<String> users = new LinkedHashSet<>();
        Set<Long> relatedIds = new LinkedHashSet<>();
        collectReferences(item, fields, users, relatedIds);

        Map<String, String> userNames = users.isEmpty() ? Collections.emptyMap() : lookupUsers(users);
        Map<Long, String> itemNames = relatedIds.isEmpty() ? Collections.emptyMap() : lookupItems(scope, relatedIds);

        ObjectNode readable = objectMapper.createObjectNode();
        for (JsonNode node : fields) {
            if (!(node instanceof ObjectNode field) || !field.hasNonNull("field_key")) {
                continue;
            }
            String fieldKey = field.path("field_key").asText();
            String fieldName = fieldName(scope, fieldKey, field.path("field_alias").asText(null));
            field.put("field_name", fieldName);
            readable.set(fieldName, readableValue(scope, field, userNames, itemNames));
        }
        enhanced.set("fields", fields);

        for (String key : ROOT_USER_KEYS) {
            JsonNode value = item.get(key);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                readable.put(key, userNames.getOrDefault(value.asText(), value.asText()));
            }
        }
        enhanced.set("readable_fields", readable);
        for (String alias : TOP_LEVEL_ALIASES) {
            if (readable.has(alias)) {
                enhanced.set("readable_" + alias, readable.get(alias));
            }
        }
        return enhanced;
    }

    // older payloads carry field_value_pairs without type information
    private ArrayNode normalizedFields(JsonNode item) {
        JsonNode fields = item.path("fields");
        if (fields.isArray() && fields.size() > 0) {
            return ((ArrayNode) fields).deepCopy();
        }
        ArrayNode converted = objectMapper.createArrayNode();
        for (JsonNode pair : item.path("field_value_pairs")) {
            ObjectNode field = converted.addObject();
            field.set("field_key", pair.path("field_key"));
            field.set("field_value", pair.path("field_value"));
            field.put("field_type_key", UNKNOWN_TYPE);
        }
        return converted;
    }

    private void collectReferences(JsonNode item, ArrayNode fields, Set<String> users, Set<Long> relatedIds) {
        for (JsonNode field : fields) {
            JsonNode value = field.path("field_value");
            if (isEmpty(value)) {
                continue;
            }
            String type = field.path("field_type_key").asText("");
            FieldTypeCategory category = FieldTypeCategory.of(type);
            if (category == FieldTypeCategory.USER && value.isTextual()) {
                users.add(value.asText());
            } else if (category == FieldTypeCategory.MULTI_USER) {
                value.forEach(user -> {
                    if (user.isTextual()) {
                        users.add(user.asText());
                    }
                });
            } else if (category == FieldTypeCategory.ROLE_OWNERS) {
                value.forEach(role -> role.path("owners").forEach(owner -> {
                    if (owner.isTextual()) {
                        users.add(owner.asText());
                    }
                }));
            } else if ("owner".equals(field.path("field_key").asText()) && value.isTextual()) {
                users.add(value.asText());
            }
            if (category.isRelation()) {
                if (value.isArray()) {
                    value.forEach(id -> toId(id).ifPresent(relatedIds::add));
                } else {
                    toId(value).ifPresent(relatedIds::add);
                }
            }
        }
        for (String key : ROOT_USER_KEYS) {
            JsonNode value = item.get(key);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                users.add(value.asText());
            }
        }
    }

    private Map<String, String> lookupUsers(Set<String> users) {
        try {
            return metadata.batchResolveUserNames(users);
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve user names: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private Map<Long, String> lookupItems(TypeScope scope, Set<Long> ids) {
        try {
            return crossTypeLookup.resolveItemNames(scope.workspaceKey(), scope.typeKey(), ids);
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve related item names: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private String fieldName(TypeScope scope, String fieldKey, String alias) {
        try {
            Optional<String> name = metadata.resolveFieldName(scope.workspaceKey(), scope.typeKey(), fieldKey);
            if (name.isPresent()) {
                return name.get();
            }
        } catch (RuntimeException e) {
            logger.debug("No field name for {}: {}", fieldKey, e.getMessage());
        }
        return alias != null && !alias.isEmpty() ? alias : fieldKey;
    }

    private JsonNode readableValue(TypeScope scope, ObjectNode field, Map<String, String> userNames, Map<Long, String> itemNames) {
        JsonNode value = field.path("field_value");
        if (value.isMissingNode() || value.isNull()) {
            return value.isMissingNode() ? objectMapper.nullNode() : value;
        }
        String type = field.path("field_type_key").asText("");
        String fieldKey = field.path("field_key").asText();
        FieldTypeCategory category = FieldTypeCategory.of(type);
        boolean userField = category == FieldTypeCategory.USER
                || (UNKNOWN_TYPE.equals(type) && USER_FIELD_KEYS.contains(fieldKey));

        if (userField) {
            return value.isTextual()
                    ? objectMapper.getNodeFactory().textNode(userNames.getOrDefault(value.asText(), value.asText()))
                    : extractReadable(value);
        }
        switch (category) {
            case MULTI_USER:
                if (value.isArray()) {
                    ArrayNode names = objectMapper.createArrayNode();
                    value.forEach(user -> names.add(user.isTextual()
                            ? objectMapper.getNodeFactory().textNode(userNames.getOrDefault(user.asText(), user.asText()))
                            : extractReadable(user)));
                    return names;
                }
                return value;
            case ROLE_OWNERS:
                return readableRoles(scope, value, userNames);
            case RELATED_ITEM:
            case RELATED_ITEMS:
                if (value.isArray()) {
                    ArrayNode names = objectMapper.createArrayNode();
                    value.forEach(id -> names.add(relatedName(id, itemNames)));
                    return names;
                }
                return relatedName(value, itemNames);
            default:
                break;
        }
        if (value.isObject() && (value.has("label") || value.has("name"))) {
            return value.hasNonNull("label") ? value.get("label") : value.get("name");
        }
        if (value.isArray() && value.size() > 0 && value.get(0).isObject()) {
            ArrayNode labels = objectMapper.createArrayNode();
            for (JsonNode option : value) {
                if (option.hasNonNull("label")) {
                    labels.add(option.get("label"));
                } else if (option.hasNonNull("name")) {
                    labels.add(option.get("name"));
                } else {
                    labels.add(option);
                }
            }
            return labels;
        }
        return value;
    }

    private JsonNode readableRoles(TypeScope scope, JsonNode value, Map<String, String> userNames) {
        if (!value.isArray()) {
            return value;
        }
        ArrayNode roles = objectMapper.createArrayNode();
        for (JsonNode role : value) {
            String roleKey = role.path("role").asText("");
            if (!role.isObject() || roleKey.isEmpty()) {
                continue;
            }
            String roleName = roleKey;
            try {
                roleName = metadata.resolveRoleName(scope.workspaceKey(), scope.typeKey(), roleKey).orElse(roleKey);
            } catch (RuntimeException e) {
                logger.debug("No role name for {}: {}", roleKey, e.getMessage());
            }
            ObjectNode readableRole = roles.addObject();
            readableRole.put("role", roleName);
            ArrayNode owners = readableRole.putArray("owners");
            role.path("owners").forEach(owner -> owners.add(userNames.getOrDefault(owner.asText(), owner.asText())));
        }
        return roles;
    }

    private JsonNode relatedName(JsonNode id, Map<Long, String> itemNames) {
        Optional<Long> itemId = toId(id);
        if (itemId.isPresent() && itemNames.containsKey(itemId.get())) {
            return objectMapper.getNodeFactory().textNode(itemNames.get(itemId.get()));
        }
        return id;
    }

    /**
     * Label or name of an object value; a singleton list of objects collapses to its element.
     */
    JsonNode extractReadable(JsonNode value) {
        if (value.isObject()) {
            for (String key : List.of("label", "name", "name_cn")) {
                if (value.has(key)) {
                    return value.get(key);
                }
            }
            return value;
        }
        if (value.isArray() && value.size() > 0) {
            if (value.size() == 1 && value.get(0).isObject()) {
                JsonNode single = value.get(0);
                for (String key : List.of("name", "name_cn", "label")) {
                    if (single.has(key)) {
                        return single.get(key);
                    }
                }
                return single;
            }
            ArrayNode readable = objectMapper.createArrayNode();
            value.forEach(element -> readable.add(extractReadable(element)));
            return readable;
        }
        return value;
    }

    private static Optional<Long> toId(JsonNode node) {
        if (node.isIntegralNumber()) {
            return Optional.of(node.asLong());
        }
        return node.isTextual() ? WorkItemPayloads.parseId(node.asText()) : Optional.empty();
    }

    private static boolean isEmpty(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return true;
        }
        return (value.isTextual() && value.asText().isEmpty()) || (value.isContainerNode() && value.size() == 0);
    }
}
