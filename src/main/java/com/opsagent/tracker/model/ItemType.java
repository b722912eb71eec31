package com.opsagent.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemType(
        @JsonProperty("name") String name,
        @JsonProperty("type_key") String typeKey
) {
}
