package com.baykanat.energy.meter.domain.model;

import com.baykanat.energy.meter.domain.exception.MalformedInputException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Sayaçta ölçülen fiziksel büyüklük: aktif ve reaktif enerji. DB'de measurement_type kolonu. */
public enum MeasurementKind {

    ACTIVE("active"),
    REACTIVE("reactive");

    private static final String BOTH = "both";

    private final String value;

    MeasurementKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** measurement_type kolonundaki değerden enum; bilinmeyen değer IllegalArgumentException. */
    public static MeasurementKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown measurement type: " + value));
    }

    /** meter parametresi → ölçüm türü kümesi; boş veya "both" ise ikisi birden. */
    public static Set<MeasurementKind> parseSelection(String selector) {
        if (selector == null || selector.isBlank() || BOTH.equalsIgnoreCase(selector.trim())) {
            return Collections.unmodifiableSet(EnumSet.allOf(MeasurementKind.class));
        }
        String trimmed = selector.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(trimmed))
                .findFirst()
                .map(kind -> Collections.unmodifiableSet(EnumSet.of(kind)))
                .orElseThrow(() -> new MalformedInputException("meter",
                        "meter must be one of active, reactive, both; got '" + selector + "'"));
    }
}
