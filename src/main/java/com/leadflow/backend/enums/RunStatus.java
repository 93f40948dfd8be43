package com.leadflow.backend.enums;

public enum RunStatus {
    SUCCESS("success", "Completed Successfully"),
    FAILED("failed", "Failed"),
    PARTIAL("partial", "Completed with Issues");

    private final String code;
    private final String headline;

    RunStatus(String code, String headline) {
        this.code = code;
        this.headline = headline;
    }

    public String getCode() {
        return code;
    }

    public String getHeadline() {
        return headline;
    }
}
