package com.opsagent.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDefinition(
        @JsonProperty("field_key") String fieldKey,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("field_alias") String fieldAlias,
        @JsonProperty("field_type_key") String fieldTypeKey,
        @JsonProperty("options") List<FieldOption> options
) {
    public FieldDefinition {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
