package com.example.exam_scheduler.model;

import java.time.LocalDate;

import lombok.NonNull;
import lombok.Value;

/**
 * Inclusive date range in which exams may be placed.
 */
@Value
public class CalendarWindow {
    @NonNull
    LocalDate startDate;
    @NonNull
    LocalDate endDate;

    public static CalendarWindow of(LocalDate startDate, LocalDate endDate) {
        return new CalendarWindow(startDate, endDate);
    }

    // spanDays = 14 gives the two-week window used when no end date is chosen
    public static CalendarWindow startingAt(LocalDate startDate, int spanDays) {
        if (spanDays < 0) {
            throw new IllegalArgumentException("Span must not be negative: " + spanDays);
        }
        return new CalendarWindow(startDate, startDate.plusDays(spanDays));
    }
}
