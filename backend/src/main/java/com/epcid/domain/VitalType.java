package com.epcid.domain;

public enum VitalType {
    TEMPERATURE("°F"),
    HEART_RATE("bpm"),
    OXYGEN("%"),
    RESPIRATORY_RATE("breaths/min"),
    SYSTOLIC_BP("mmHg");

    private final String defaultUnit;

    VitalType(String defaultUnit) {
        this.defaultUnit = defaultUnit;
    }

    public String getDefaultUnit() {
        return defaultUnit;
    }
}
