package com.locationscout.core.model;

/** 사이트 결과 버킷 */
public enum OutcomeStatus {
    SUCCESS_WITH_LOCATIONS("success-with-locations"),
    SUCCESS_NO_LOCATIONS("success-no-locations"),
    ERROR("error"),
    SKIPPED_INVALID_URL("skipped-invalid-url");

    private final String label;

    OutcomeStatus(String label) { this.label = label; }

    public String label() { return label; }
}
