package com.epcid.catalog;

import java.util.Optional;

public enum BodyRegion {
    HEAD("Head", "If unresponsive, severe head injury, or seizure, call 911 immediately"),
    EYES("Eyes", null),
    EARS("Ears", null),
    NOSE_THROAT("Nose & Throat", null),
    CHEST("Chest", "If blue lips, gasping, or unable to speak, call 911 immediately"),
    STOMACH("Stomach", "If rigid abdomen, blood in vomit, or severe pain with fever, call 911"),
    SKIN("Skin", "If throat swelling, difficulty breathing, or spreading rash with fever, call 911"),
    LIMBS("Arms & Legs", null),
    GENERAL("General / Other", "If child is unresponsive, having seizures, or lips turning blue, call 911");

    private final String displayName;
    private final String emergencyWarning;

    BodyRegion(String displayName, String emergencyWarning) {
        this.displayName = displayName;
        this.emergencyWarning = emergencyWarning;
    }

    public String getDisplayName() {
        return displayName;
    }

    // Banner text only, never feeds the triage decision
    public Optional<String> getEmergencyWarning() {
        return Optional.ofNullable(emergencyWarning);
    }
}
