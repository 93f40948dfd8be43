package com.leadflow.backend.enums;

public enum SequenceTriggerType {
    MANUAL("Manual"),
    STATUS_CHANGE("Status Change"),
    TIME_BASED("Time Based");

    private final String displayName;

    SequenceTriggerType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
