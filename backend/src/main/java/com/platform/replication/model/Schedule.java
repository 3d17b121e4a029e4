package com.platform.replication.model;

public record Schedule(ScheduleMode mode, String rpo, String rto) {

    public static Schedule continuous() {
        return new Schedule(ScheduleMode.CONTINUOUS, null, null);
    }
}
