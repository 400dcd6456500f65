package com.identity.resolution.core.model;

/**
 * Coarse type tag assigned to a mention by the name parser adapter.
 */
public enum ParseType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    HOUSEHOLD("Household"),
    UNKNOWN("Unknown");

    private final String label;

    ParseType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true for every type except {@link #UNKNOWN}.
     */
    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Two types conflict when both are known and differ.
     * An unknown type never conflicts with anything.
     */
    public boolean conflictsWith(ParseType other) {
        return other != null && isKnown() && other.isKnown() && this != other;
    }
}
