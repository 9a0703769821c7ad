package com.example.exam_scheduler.model;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.enums.SubjectKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An examinable course unit as seen by one scheduling run.
 */
@Value
@Builder
public class Subject {
    Long id;
    String code;
    String name;
    @NonNull
    SubjectKind kind;
    String semester;
    @NonNull
    Difficulty difficulty;
    int durationMinutes;

    public String describe() {
        return String.format("%s %s (id %d)", code, name, id);
    }
}
