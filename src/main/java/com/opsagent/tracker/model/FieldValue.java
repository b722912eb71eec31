package com.opsagent.tracker.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A field value already shaped for the write API. One variant per field type category; the
 * resolver picks the variant once and the write path only ever serialises it.
 */
public interface FieldValue {

    JsonNode toWire(ObjectMapper mapper);

    /**
     * Human-readable form used in results and logs.
     */
    Object display();

    /**
     * Free text, numbers, booleans, dates: written as given.
     */
    record Scalar(Object raw) implements FieldValue {
        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            return mapper.valueToTree(raw);
        }

        @Override
        public Object display() {
            return raw;
        }
    }

    record Option(String label, String value) implements FieldValue {
        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            ObjectNode node = mapper.createObjectNode();
            node.put("label", label);
            node.put("value", value);
            return node;
        }

        @Override
        public Object display() {
            return label;
        }
    }

    /**
     * Multi-select value. An empty list clears the field.
     */
    record MultiOption(List<Option> options) implements FieldValue {
        public MultiOption {
            options = List.copyOf(options);
        }

        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            ArrayNode array = mapper.createArrayNode();
            options.forEach(option -> array.add(option.toWire(mapper)));
            return array;
        }

        @Override
        public Object display() {
            return options.stream().map(Option::label).collect(Collectors.toList());
        }
    }

    record UserRef(String userKey) implements FieldValue {
        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            return mapper.getNodeFactory().textNode(userKey);
        }

        @Override
        public Object display() {
            return userKey;
        }
    }

    record MultiUserRef(List<String> userKeys) implements FieldValue {
        public MultiUserRef {
            userKeys = List.copyOf(userKeys);
        }

        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            ArrayNode array = mapper.createArrayNode();
            userKeys.forEach(array::add);
            return array;
        }

        @Override
        public Object display() {
            return userKeys;
        }
    }

    /**
     * Reference to other work items by id; single-valued relation fields take a bare number.
     */
    record RelatedItemRef(List<Long> itemIds, boolean multi) implements FieldValue {
        public RelatedItemRef {
            itemIds = List.copyOf(itemIds);
        }

        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            if (!multi && itemIds.size() == 1) {
                return mapper.getNodeFactory().numberNode(itemIds.get(0));
            }
            ArrayNode array = mapper.createArrayNode();
            itemIds.forEach(array::add);
            return array;
        }

        @Override
        public Object display() {
            return multi ? itemIds : itemIds.isEmpty() ? null : itemIds.get(0);
        }
    }

    record RoleAssignment(String roleKey, List<String> ownerKeys) {
        public RoleAssignment {
            ownerKeys = List.copyOf(ownerKeys);
        }
    }

    record RoleOwners(List<RoleAssignment> assignments) implements FieldValue {
        public RoleOwners {
            assignments = List.copyOf(assignments);
        }

        @Override
        public JsonNode toWire(ObjectMapper mapper) {
            ArrayNode array = mapper.createArrayNode();
            for (RoleAssignment assignment : assignments) {
                ObjectNode node = array.addObject();
                node.put("role", assignment.roleKey());
                ArrayNode owners = node.putArray("owners");
                assignment.ownerKeys().forEach(owners::add);
            }
            return array;
        }

        @Override
        public Object display() {
            Map<String, List<String>> view = new LinkedHashMap<>();
            assignments.forEach(a -> view.put(a.roleKey(), a.ownerKeys()));
            return view;
        }
    }
}
