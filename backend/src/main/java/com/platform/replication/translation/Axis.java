package com.platform.replication.translation;

/**
 * Vocabulary axis a token belongs to.
 */
public enum Axis {
    STATE("state"),
    MODE("mode");

    private final String label;

    Axis(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
