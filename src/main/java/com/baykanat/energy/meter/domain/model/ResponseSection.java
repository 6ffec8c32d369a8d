package com.baykanat.energy.meter.domain.model;

import com.baykanat.energy.meter.domain.exception.MalformedInputException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** include parametresiyle istenebilen isteğe bağlı yanıt bölümleri. */
public enum ResponseSection {

    STATS("stats"),
    PATTERNS("patterns"),
    HEATMAP("heatmap"),
    COST("cost");

    private final String value;

    ResponseSection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Virgülle ayrılmış liste; boşsa hiçbir bölüm istenmemiştir. */
    public static Set<ResponseSection> parseInclude(String include) {
        if (include == null || include.isBlank()) {
            return Collections.emptySet();
        }
        Set<ResponseSection> sections = EnumSet.noneOf(ResponseSection.class);
        for (String token : include.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            sections.add(Arrays.stream(values())
                    .filter(section -> section.value.equalsIgnoreCase(trimmed))
                    .findFirst()
                    .orElseThrow(() -> new MalformedInputException("include",
                            "include entries must be stats, patterns, heatmap or cost; got '" + trimmed + "'")));
        }
        return sections;
    }
}
