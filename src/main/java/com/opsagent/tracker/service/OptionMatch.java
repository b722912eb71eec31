package com.opsagent.tracker.service;

import java.util.List;
import java.util.Optional;

/**
 * Result of a loose option lookup: a single value, several equally good candidates, or nothing.
 */
public record OptionMatch(String label, String value, List<String> candidates) {

    private static final OptionMatch NONE = new OptionMatch(null, null, List.of());

    public static OptionMatch of(String label, String value) {
        return new OptionMatch(label, value, List.of());
    }

    public static OptionMatch ambiguous(List<String> candidates) {
        return new OptionMatch(null, null, List.copyOf(candidates));
    }

    public static OptionMatch none() {
        return NONE;
    }

    public boolean matched() {
        return value != null;
    }

    public boolean isAmbiguous() {
        return value == null && candidates.size() > 1;
    }

    public Optional<String> toOptional() {
        return Optional.ofNullable(value);
    }
}
