package com.opsagent.tracker.service;

import com.opsagent.tracker.model.FieldTypeCategory;
import com.opsagent.tracker.model.FieldValue;
import com.opsagent.tracker.model.TypeScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shapes a human value into the structure the write API expects for the target field.
 */
@Service
public class FieldValueResolver {

    private static final Logger logger = LoggerFactory.getLogger(FieldValueResolver.class);

    static final String OWNER_FIELD_KEY = "owner";
    private static final String SLASH_SEPARATOR = " / ";
    private static final List<String> SEPARATORS = List.of(",", ";", "|");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0");

    private final MetadataCacheManager metadata;

    public FieldValueResolver(MetadataCacheManager metadata) {
        this.metadata = metadata;
    }

    /**
     * Resolves {@code value} for a write to {@code fieldKey}.
     *
     * @throws FieldValidationException when a boolean or multi-select field cannot accept the value
     * @throws MetadataNotFoundException when a referenced user or role does not exist
     */
    public FieldValue resolveForUpdate(TypeScope scope, String fieldKey, String fieldName, Object value) {
        String typeKey = metadata.resolveFieldType(scope.workspaceKey(), scope.typeKey(), fieldKey).orElse(null);
        FieldTypeCategory category = OWNER_FIELD_KEY.equals(fieldKey) ? FieldTypeCategory.USER : FieldTypeCategory.of(typeKey);
        String label = fieldName != null ? fieldName : fieldKey;

        switch (category) {
            case USER:
                return new FieldValue.UserRef(metadata.resolveUserKey(requireSingleText(label, value), scope.workspaceKey()));
            case MULTI_USER:
                return new FieldValue.MultiUserRef(splitValues(value).stream()
                        .map(identifier -> metadata.resolveUserKey(identifier, scope.workspaceKey()))
                        .collect(Collectors.toList()));
            case RELATED_ITEM:
            case RELATED_ITEMS:
                return new FieldValue.RelatedItemRef(parseItemIds(label, value), category == FieldTypeCategory.RELATED_ITEMS);
            case ROLE_OWNERS:
                return resolveRoleOwners(scope, label, value);
            default:
                return resolveOptionOrScalar(scope, fieldKey, label, category, value);
        }
    }

    /**
     * Plain option value for search and filter conditions; falls back to the input when it is not an option.
     */
    public String resolveFilterValue(TypeScope scope, String fieldKey, String value) {
        OptionMatch match = metadata.matchOption(scope.workspaceKey(), scope.typeKey(), fieldKey, value);
        if (match.matched()) {
            logger.info("Resolved option '{}' -> '{}' for field {}", value, match.value(), fieldKey);
            return match.value();
        }
        logger.warn("Failed to resolve option '{}' for field {}, using it as is", value, fieldKey);
        return value;
    }

    private FieldValue resolveOptionOrScalar(TypeScope scope, String fieldKey, String label,
                                             FieldTypeCategory category, Object value) {
        boolean multi = category == FieldTypeCategory.MULTI_SELECT;
        if (multi && (value == null || (value instanceof String s && s.isBlank()))) {
            logger.info("Empty value for multi-select field '{}', clearing it", label);
            return new FieldValue.MultiOption(List.of());
        }

        if (value instanceof Collection<?> items) {
            List<FieldValue> resolved = new ArrayList<>();
            for (Object item : items) {
                resolved.add(resolveOptionOrScalar(scope, fieldKey, label, category, item));
            }
            return combine(resolved, items);
        }

        // Free text keeps its punctuation; only option fields are split.
        if (value instanceof String text && containsSeparator(text)
                && !metadata.listOptions(scope.workspaceKey(), scope.typeKey(), fieldKey).isEmpty()
                && !metadata.matchOption(scope.workspaceKey(), scope.typeKey(), fieldKey, text).matched()) {
            List<String> parts = splitOnFirstSeparator(text);
            if (parts.size() > 1) {
                logger.info("Splitting multi-value input '{}' into {}", text, parts);
                return resolveOptionOrScalar(scope, fieldKey, label, category, parts);
            }
        }

        String asText = value == null ? null : String.valueOf(value);
        OptionMatch match = metadata.matchOption(scope.workspaceKey(), scope.typeKey(), fieldKey, asText);
        if (match.matched()) {
            FieldValue.Option option = new FieldValue.Option(asText, match.value());
            logger.info("Resolved option for update '{}' -> '{}' for field '{}'", asText, match.value(), label);
            return multi ? new FieldValue.MultiOption(List.of(option)) : option;
        }
        logger.debug("'{}' is not an option of field '{}'", asText, label);

        if (category == FieldTypeCategory.BOOL) {
            return new FieldValue.Scalar(parseBoolean(label, value));
        }
        if (multi) {
            String hint = match.isAmbiguous() ? " (ambiguous: " + match.candidates() + ")" : "";
            logger.warn("Cannot resolve '{}' for multi-select field '{}'{}", value, label, hint);
            throw new FieldValidationException(label, value,
                    "Cannot update multi-select field '" + label + "': '" + value + "' is not an available option" + hint);
        }
        return new FieldValue.Scalar(value);
    }

    // Option elements collapse into one multi-option value; anything else is written as the raw list.
    private FieldValue combine(List<FieldValue> resolved, Collection<?> raw) {
        List<FieldValue.Option> options = new ArrayList<>();
        for (FieldValue value : resolved) {
            if (value instanceof FieldValue.Option option) {
                options.add(option);
            } else if (value instanceof FieldValue.MultiOption multiOption) {
                options.addAll(multiOption.options());
            } else {
                return new FieldValue.Scalar(new ArrayList<>(raw));
            }
        }
        return new FieldValue.MultiOption(options);
    }

    private Boolean parseBoolean(String label, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String lower = text.strip().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(lower)) {
                return Boolean.TRUE;
            }
            if (FALSE_WORDS.contains(lower)) {
                return Boolean.FALSE;
            }
        }
        logger.warn("Invalid value '{}' for bool field '{}'. Expected true/yes/on/1 or false/no/off/0", value, label);
        throw new FieldValidationException(label, value,
                "Cannot update bool field '" + label + "': '" + value + "' is not a valid boolean");
    }

    private FieldValue resolveRoleOwners(TypeScope scope, String label, Object value) {
        if (!(value instanceof Map<?, ?> roles)) {
            throw new FieldValidationException(label, value,
                    "Field '" + label + "' expects a map of role name to owners");
        }
        List<FieldValue.RoleAssignment> assignments = new ArrayList<>();
        for (Map.Entry<?, ?> entry : roles.entrySet()) {
            String roleKey = metadata.resolveRoleKey(scope.workspaceKey(), scope.typeKey(), String.valueOf(entry.getKey()));
            List<String> owners = new ArrayList<>();
            for (String identifier : splitValues(entry.getValue())) {
                owners.add(metadata.resolveUserKey(identifier, scope.workspaceKey()));
            }
            assignments.add(new FieldValue.RoleAssignment(roleKey, owners));
        }
        return new FieldValue.RoleOwners(assignments);
    }

    private List<Long> parseItemIds(String label, Object value) {
        List<Long> ids = new ArrayList<>();
        List<Object> raw = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            raw.addAll(items);
        } else if (value instanceof String text) {
            raw.addAll(splitValues(text));
        } else if (value != null) {
            raw.add(value);
        }
        for (Object item : raw) {
            Optional<Long> id = toItemId(item);
            if (id.isEmpty()) {
                throw new FieldValidationException(label, value,
                        "Field '" + label + "' expects work item ids, got '" + item + "'");
            }
            ids.add(id.get());
        }
        return ids;
    }

    static Optional<Long> toItemId(Object item) {
        if (item instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (item instanceof String text) {
            return WorkItemPayloads.parseId(text.strip());
        }
        return Optional.empty();
    }

    private static String requireSingleText(String label, Object value) {
        if (value instanceof String text && StringUtils.hasText(text)) {
            return text.strip();
        }
        throw new FieldValidationException(label, value, "Field '" + label + "' expects a single user");
    }

    private static List<String> splitValues(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && StringUtils.hasText(String.valueOf(item))) {
                    values.add(String.valueOf(item).strip());
                }
            }
        } else if (value instanceof String text) {
            values.addAll(containsSeparator(text) ? splitOnFirstSeparator(text) : List.of(text.strip()));
            values.removeIf(String::isEmpty);
        } else if (value != null) {
            values.add(String.valueOf(value));
        }
        return values;
    }

    static boolean containsSeparator(String text) {
        return text.contains(SLASH_SEPARATOR) || SEPARATORS.stream().anyMatch(text::contains);
    }

    /**
     * Splits on " / " when present, otherwise on the first of {@code , ; |} found.
     */
    static List<String> splitOnFirstSeparator(String text) {
        String separator = text.contains(SLASH_SEPARATOR) ? SLASH_SEPARATOR
                : SEPARATORS.stream().filter(text::contains).findFirst().orElse(null);
        if (separator == null) {
            return List.of(text.strip());
        }
        List<String> parts = new ArrayList<>();
        for (String part : text.split(Pattern.quote(separator))) {
            if (!part.isBlank()) {
                parts.add(part.strip());
            }
        }
        return parts;
    }
}
