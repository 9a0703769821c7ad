package com.example.exam_scheduler.engine;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.exam_scheduler.exceptions.SchedulingException;
import com.example.exam_scheduler.exceptions.SchedulingFailure;
import com.example.exam_scheduler.model.CalendarWindow;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a calendar window into the ordered list of days exams may use.
 * Sundays are always skipped.
 */
@Slf4j
public class CalendarBuilder {
    public static final DayOfWeek EXCLUDED_DAY = DayOfWeek.SUNDAY;

    public List<LocalDate> build(CalendarWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("Calendar window cannot be null");
        }
        LocalDate start = window.getStartDate();
        LocalDate end = window.getEndDate();
        if (start.isAfter(end)) {
            throw new SchedulingException(SchedulingFailure.INVALID_RANGE, start + " is after " + end);
        }

        List<LocalDate> days = new ArrayList<>();
        for (LocalDate current = start; !current.isAfter(end); current = current.plusDays(1)) {
            if (current.getDayOfWeek() == EXCLUDED_DAY) {
                log.debug("Skipping {}: {}", EXCLUDED_DAY, current);
                continue;
            }
            days.add(current);
        }

        if (days.isEmpty()) {
            throw new SchedulingException(SchedulingFailure.EMPTY_CALENDAR, start + " to " + end);
        }
        log.info("Scheduling period {} to {}: {} exam days", start, end, days.size());
        return Collections.unmodifiableList(days);
    }
}
