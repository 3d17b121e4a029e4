package com.platform.replication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ScheduleMode {
    CONTINUOUS("continuous"),
    INTERVAL("interval"),
    MANUAL("manual");

    private final String value;

    ScheduleMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    static ScheduleMode forJson(String value) {
        return Arrays.stream(values())
            .filter(m -> m.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown schedule mode: " + value));
    }
}
