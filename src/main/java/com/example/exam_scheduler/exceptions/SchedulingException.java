package com.example.exam_scheduler.exceptions;

import java.util.Optional;

import com.example.exam_scheduler.model.Subject;

import lombok.Getter;

/**
 * A scheduling run that ended without a schedule. The failure kind tells the
 * caller why; nothing is retried or relaxed before this is thrown.
 */
@Getter
public class SchedulingException extends RuntimeException {
    private final SchedulingFailure failure;
    private final transient Subject subject;

    public SchedulingException(SchedulingFailure failure, String message) {
        this(failure, message, null);
    }

    public SchedulingException(SchedulingFailure failure, String message, Subject subject) {
        super(failure.getSummary() + ": " + message);
        this.failure = failure;
        this.subject = subject;
    }

    public static SchedulingException noCompatibleRoom(Subject subject) {
        return new SchedulingException(SchedulingFailure.NO_COMPATIBLE_ROOM,
            subject.describe() + " (" + subject.getKind().getLabel() + ")", subject);
    }

    /** The subject the failure is about, present only for {@link SchedulingFailure#NO_COMPATIBLE_ROOM}. */
    public Optional<Subject> getSubject() {
        return Optional.ofNullable(subject);
    }
}
