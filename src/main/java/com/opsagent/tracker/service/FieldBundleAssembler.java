package com.opsagent.tracker.service;

import com.opsagent.tracker.model.FieldBundle;
import com.opsagent.tracker.model.FieldDefinition;
import com.opsagent.tracker.model.FieldOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-type {@link FieldBundle} from the raw field schema.
 */
@Component
public class FieldBundleAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FieldBundleAssembler.class);
    static final int MAX_OPTION_DEPTH = 20;

    private final RoleKeyExtractor roleKeyExtractor;

    public FieldBundleAssembler(RoleKeyExtractor roleKeyExtractor) {
        this.roleKeyExtractor = roleKeyExtractor;
    }

    public FieldBundle assemble(List<FieldDefinition> definitions) {
        Map<String, String> nameToKey = new LinkedHashMap<>();
        Map<String, String> keyToName = new LinkedHashMap<>();
        Map<String, String> keyToType = new LinkedHashMap<>();
        Map<String, Map<String, String>> options = new LinkedHashMap<>();
        Map<String, String> roles = new LinkedHashMap<>();

        for (FieldDefinition field : definitions) {
            String key = field.fieldKey();
            String name = field.fieldName() == null ? null : field.fieldName().strip();
            String alias = field.fieldAlias() == null ? null : field.fieldAlias().strip();

            if (StringUtils.hasText(name) && StringUtils.hasText(key)) {
                nameToKey.put(name, key);
                keyToName.putIfAbsent(key, name);
                if (StringUtils.hasText(alias)) {
                    nameToKey.put(alias, key);
                }
            }
            if (StringUtils.hasText(key) && StringUtils.hasText(field.fieldTypeKey())) {
                keyToType.put(key, field.fieldTypeKey());
            }
            if (StringUtils.hasText(key) && !field.options().isEmpty()) {
                Map<String, String> labels = new LinkedHashMap<>();
                flattenOptions(key, field.options(), labels, 0);
                options.put(key, labels);

                if (RoleKeyExtractor.OPERATOR_ROLE_FIELD_KEY.equals(key)) {
                    for (FieldOption option : field.options()) {
                        if (StringUtils.hasText(option.label()) && StringUtils.hasText(option.value())) {
                            roles.put(option.label(), roleKeyExtractor.extract(option.value()));
                        }
                    }
                }
            }
        }
        logger.debug("Assembled field bundle: {} names, {} option sets, {} roles",
                nameToKey.size(), options.size(), roles.size());
        return new FieldBundle(nameToKey, keyToName, keyToType, options, roles);
    }

    // Tree selects nest options; labels collide across branches and the last one wins.
    private void flattenOptions(String fieldKey, List<FieldOption> source, Map<String, String> target, int depth) {
        if (depth > MAX_OPTION_DEPTH) {
            logger.warn("Option tree of field {} deeper than {}, ignoring the rest", fieldKey, MAX_OPTION_DEPTH);
            return;
        }
        for (FieldOption option : source) {
            if (option == null) {
                continue;
            }
            String label = option.label() == null ? null : option.label().strip();
            String value = option.value();
            if (StringUtils.hasText(label) && StringUtils.hasText(value)) {
                String previous = target.put(label, value);
                if (previous != null && !previous.equals(value)) {
                    logger.warn("Option label collision on field {}: '{}' ({} replaced by {})",
                            fieldKey, label, previous, value);
                }
            }
            if (!option.children().isEmpty()) {
                flattenOptions(fieldKey, option.children(), target, depth + 1);
            }
        }
    }
}
