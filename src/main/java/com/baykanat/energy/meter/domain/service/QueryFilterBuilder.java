package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.domain.exception.MalformedInputException;
import com.baykanat.energy.meter.domain.model.DayPeriod;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Ham istek kısıtlarını QueryFilter'a çevirir. Boş değer kısıt yok demektir, hata değil. */
@Component
public class QueryFilterBuilder {

    public QueryFilter build(String start, String end, String meter, Boolean weekdayOnly, Boolean weekendOnly) {
        LocalDate startDate = parseDate("start", start);
        LocalDate endDate = parseDate("end", end);
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new MalformedInputException("end", "end (" + endDate + ") is before start (" + startDate + ")");
        }

        return QueryFilter.builder()
                .startDate(startDate)
                .endDate(endDate)
                .measurementKinds(MeasurementKind.parseSelection(meter))
                .dayPeriod(dayPeriod(weekdayOnly, weekendOnly))
                .build();
    }

    /** İkisi birden true ise weekday-only geçerli. */
    static DayPeriod dayPeriod(Boolean weekdayOnly, Boolean weekendOnly) {
        if (Boolean.TRUE.equals(weekdayOnly)) {
            return DayPeriod.WEEKDAY;
        }
        if (Boolean.TRUE.equals(weekendOnly)) {
            return DayPeriod.WEEKEND;
        }
        return DayPeriod.ALL;
    }

    private static LocalDate parseDate(String parameter, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new MalformedInputException(parameter,
                    parameter + " must be an ISO date (yyyy-MM-dd), got '" + value + "'", e);
        }
    }
}
