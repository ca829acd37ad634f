package com.epcid.domain;

public enum Severity {
    MILD(1),
    MODERATE(2),
    SEVERE(3);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    /**
     * Multiplier used by the aggregate risk score.
     */
    public int getWeight() {
        return weight;
    }
}
