package com.phillippitts.callcopilot.domain;

/**
 * Wire value of the {@code type} field on forwarded transcripts.
 */
public enum SegmentType {
    PARTIAL("partial"),
    FINAL("final");

    private final String wireValue;

    SegmentType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
