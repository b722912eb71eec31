package com.opsagent.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackerUser(
        @JsonProperty("user_key") String userKey,
        @JsonProperty("name_cn") String nameCn,
        @JsonProperty("name_en") String nameEn,
        @JsonProperty("email") String email
) {

    /**
     * Chinese name first, then English name; null when the directory entry carries neither.
     */
    public String displayName() {
        if (nameCn != null && !nameCn.isBlank()) {
            return nameCn;
        }
        if (nameEn != null && !nameEn.isBlank()) {
            return nameEn;
        }
        return null;
    }
}
