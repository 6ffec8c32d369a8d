package com.baykanat.energy.meter.domain.model;

/** İki tarife sınıfı; JSON'da "high" / "low" olarak yazılır. */
public enum TariffClass {

    PEAK("high"),
    OFF_PEAK("low");

    private final String label;

    TariffClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
