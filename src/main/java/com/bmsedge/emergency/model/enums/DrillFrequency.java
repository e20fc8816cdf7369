package com.bmsedge.emergency.model.enums;

public enum DrillFrequency {
    QUARTERLY(90),
    BIANNUAL(180),
    ANNUAL(365);

    private final int intervalDays;

    DrillFrequency(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public int getIntervalDays() {
        return intervalDays;
    }
}
