package com.platform.replication.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionStatus {
    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");

    private final String value;

    ConditionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ConditionStatus of(boolean value) {
        return value ? TRUE : FALSE;
    }
}
