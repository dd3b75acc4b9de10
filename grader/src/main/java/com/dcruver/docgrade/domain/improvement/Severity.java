package com.dcruver.docgrade.domain.improvement;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How urgently an improvement should be made.
 */
public enum Severity {
    /**
     * Missing required metadata or a document far over its size budget
     */
    HIGH,

    /**
     * Missing sections and best-practice patterns
     */
    MEDIUM,

    /**
     * Documentation polish
     */
    LOW;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
