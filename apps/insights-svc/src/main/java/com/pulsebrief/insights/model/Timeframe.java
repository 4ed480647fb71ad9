package com.pulsebrief.insights.model;

public enum Timeframe {
    WOW(7),
    MOM(30),
    QOQ(90),
    YOY(365);

    private final int days;

    Timeframe(int days) {
        this.days = days;
    }

    public int days() {
        return days;
    }

    /** Windows long enough to report a fitted slope. */
    public boolean isMediumTerm() {
        return this == MOM || this == QOQ;
    }

    /** Windows long enough to report period growth and a compounding rate. */
    public boolean isLongTerm() {
        return this == QOQ || this == YOY;
    }
}
