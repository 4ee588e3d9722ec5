package com.eyelevel.reportjobs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The fixed set of document kinds a job can produce.
 */
public enum ArtifactType {
    EXECUTIVE("executive"),
    TECHNICAL("technical"),
    COMPLIANCE("compliance");

    private final String wireName;

    ArtifactType(final String wireName) {
        this.wireName = wireName;
    }

    /**
     * The lowercase name used in API payloads, storage keys and the persisted type list.
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ArtifactType fromWireName(final String value) {
        return Arrays.stream(values())
                     .filter(type -> type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Unknown artifact type: " + value));
    }
}
