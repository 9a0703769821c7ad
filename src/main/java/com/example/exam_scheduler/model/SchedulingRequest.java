package com.example.exam_scheduler.model;

import java.util.List;

import com.example.exam_scheduler.solver.SolveBudget;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable snapshot of everything one scheduling run needs.
 * Null settings or a null budget mean the configured defaults apply.
 */
@Value
@Builder
public class SchedulingRequest {
    @Singular
    List<Subject> subjects;
    @Singular
    List<Room> rooms;
    @NonNull
    CalendarWindow window;
    SchedulingSettings settings;
    SolveBudget budget;
}
