package com.leadflow.backend.enums;

public enum LeadStatus {
    NEW("New"),
    CONTACTED("Contacted"),
    QUALIFIED("Qualified"),
    UNQUALIFIED("Unqualified"),
    CONVERTED("Converted");

    private final String displayName;

    LeadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Leads in a closed state are no longer worth outreach.
     */
    public boolean isClosed() {
        return this == CONVERTED || this == UNQUALIFIED;
    }
}
