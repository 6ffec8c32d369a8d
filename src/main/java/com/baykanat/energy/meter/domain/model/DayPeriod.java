package com.baykanat.energy.meter.domain.model;

/** Hafta içi / hafta sonu kısıtı; ISO takvimine göre Cumartesi ve Pazar hafta sonudur. */
public enum DayPeriod {
    ALL,
    WEEKDAY,
    WEEKEND
}
