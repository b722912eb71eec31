package com.opsagent.tracker.service;

import java.util.List;
import java.util.Locale;

/**
 * A name could not be resolved to a key. Always carries the alternatives the caller could use instead.
 */
public class MetadataNotFoundException extends RuntimeException {

    private static final int MAX_LISTED = 10;

    public enum Kind {
        WORKSPACE, ITEM_TYPE, FIELD, OPTION, ROLE, USER, WORK_ITEM
    }

    private final Kind kind;
    private final String requested;
    private final List<String> alternatives;
    private final boolean ambiguous;

    public MetadataNotFoundException(Kind kind, String requested, List<String> alternatives) {
        this(kind, requested, alternatives, false);
    }

    private MetadataNotFoundException(Kind kind, String requested, List<String> alternatives, boolean ambiguous) {
        super(buildMessage(kind, requested, alternatives, ambiguous));
        this.kind = kind;
        this.requested = requested;
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        this.ambiguous = ambiguous;
    }

    /**
     * Several options matched loosely and none can be preferred; {@code candidates} are those matches.
     */
    public static MetadataNotFoundException ambiguous(Kind kind, String requested, List<String> candidates) {
        return new MetadataNotFoundException(kind, requested, candidates, true);
    }

    public Kind getKind() {
        return kind;
    }

    public String getRequested() {
        return requested;
    }

    public List<String> getAlternatives() {
        return alternatives;
    }

    public boolean isAmbiguous() {
        return ambiguous;
    }

    private static String buildMessage(Kind kind, String requested, List<String> alternatives, boolean ambiguous) {
        String label = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        List<String> listed = alternatives == null ? List.of()
                : alternatives.subList(0, Math.min(MAX_LISTED, alternatives.size()));
        String more = alternatives != null && alternatives.size() > MAX_LISTED
                ? " (+" + (alternatives.size() - MAX_LISTED) + " more)" : "";
        if (ambiguous) {
            return String.format("%s '%s' is ambiguous, matching candidates: %s%s", capitalize(label), requested, listed, more);
        }
        return String.format("%s '%s' not found. Available: %s%s", capitalize(label), requested, listed, more);
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
