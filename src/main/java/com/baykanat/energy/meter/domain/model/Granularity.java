package com.baykanat.energy.meter.domain.model;

import com.baykanat.energy.meter.domain.exception.MalformedInputException;

import java.util.Arrays;

/** Toplulaştırma seviyesi; raw dışındakiler DATE_TRUNC birimine karşılık gelir. */
public enum Granularity {

    RAW("raw", null),
    HOURLY("hourly", "hour"),
    DAILY("daily", "day"),
    WEEKLY("weekly", "week");

    private final String value;
    private final String truncUnit;

    Granularity(String value, String truncUnit) {
        this.value = value;
        this.truncUnit = truncUnit;
    }

    public String getValue() {
        return value;
    }

    public String getTruncUnit() {
        return truncUnit;
    }

    public boolean isBucketed() {
        return this != RAW;
    }

    /** aggregation parametresi → Granularity; boşsa raw. */
    public static Granularity parse(String value) {
        if (value == null || value.isBlank()) {
            return RAW;
        }
        return Arrays.stream(values())
                .filter(g -> g.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new MalformedInputException("aggregation",
                        "aggregation must be one of raw, hourly, daily, weekly; got '" + value + "'"));
    }
}
