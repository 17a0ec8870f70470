package com.dice.ast;

/**
 * Reroll mechanics selected by the marker after {@code r}.
 */
public enum RerollType {
    /**
     * {@code r}: keep the original face and add every further roll while the condition holds.
     */
    EXPLODING(""),
    /**
     * {@code ro}: replace a matching face exactly once.
     */
    ONCE("o"),
    /**
     * {@code rr}: replace the face until it no longer matches.
     */
    RECURSIVE("r");

    private final String marker;

    RerollType(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public String displayName() {
        return name().toLowerCase();
    }

    public static RerollType fromMarker(String marker) {
        String normalized = marker == null ? "" : marker;
        for (RerollType type : values()) {
            if (type.marker.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown reroll marker: r" + normalized);
    }
}
