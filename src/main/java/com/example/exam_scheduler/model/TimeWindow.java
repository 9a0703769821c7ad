package com.example.exam_scheduler.model;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import lombok.Value;

/**
 * Time of day during which an exam sits, e.g. {@code 09:00 AM - 12:00 PM}.
 */
@Value
public class TimeWindow {
    public static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);
    private static final String SEPARATOR = " - ";

    LocalTime start;
    LocalTime end;

    public TimeWindow(LocalTime start, LocalTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window bounds cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Time window must start before it ends: " + start + " - " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static TimeWindow parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Time window text cannot be null");
        }
        String[] parts = text.split(SEPARATOR);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected '<start> - <end>' but got: " + text);
        }
        try {
            return new TimeWindow(
                LocalTime.parse(parts[0].trim().toUpperCase(Locale.US), TIME_FORMATTER),
                LocalTime.parse(parts[1].trim().toUpperCase(Locale.US), TIME_FORMATTER));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time window: " + text, e);
        }
    }

    public static String formatTime(LocalTime time) {
        return TIME_FORMATTER.format(time);
    }

    public String format() {
        return formatTime(start) + SEPARATOR + formatTime(end);
    }
}
