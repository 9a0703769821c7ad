package com.example.exam_scheduler.model;

import java.time.LocalDate;
import java.time.LocalTime;

import lombok.Value;

/**
 * One placed exam: which subject sits where, on which day, at what time.
 */
@Value
public class ScheduleItem {
    Subject subject;
    Room room;
    LocalDate examDate;
    LocalTime startTime;
    LocalTime endTime;

    public String formattedStartTime() {
        return TimeWindow.formatTime(startTime);
    }

    public String formattedEndTime() {
        return TimeWindow.formatTime(endTime);
    }
}
