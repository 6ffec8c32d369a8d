package com.baykanat.energy.meter.domain.model;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

/** PostgreSQL DOW numaralandırması (0=Pazar … 6=Cumartesi) için yardımcılar. */
public final class WeekDays {

    public static final int DAYS_IN_WEEK = 7;

    private WeekDays() {
    }

    public static String name(int dayOfWeek) {
        return toDayOfWeek(dayOfWeek).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /** ISO hafta sonu: Cumartesi ve Pazar. */
    public static boolean isWeekend(int dayOfWeek) {
        DayOfWeek day = toDayOfWeek(dayOfWeek);
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /** Pazar'dan başlayan gün adları; heatmap kolon etiketleri. */
    public static List<String> labels() {
        return IntStream.range(0, DAYS_IN_WEEK).mapToObj(WeekDays::name).toList();
    }

    private static DayOfWeek toDayOfWeek(int dayOfWeek) {
        if (dayOfWeek < 0 || dayOfWeek >= DAYS_IN_WEEK) {
            throw new IllegalArgumentException("day of week must be 0..6, got " + dayOfWeek);
        }
        return dayOfWeek == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
    }
}
