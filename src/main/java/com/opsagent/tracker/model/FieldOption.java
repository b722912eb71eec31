package com.opsagent.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One selectable option of a select-type field. Tree selects nest further options under {@code children}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldOption(String label, String value, List<FieldOption> children) {

    public FieldOption {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public FieldOption(String label, String value) {
        this(label, value, List.of());
    }
}
