package com.example.exam_scheduler.exceptions;

import lombok.Getter;

@Getter
public enum SchedulingFailure {
  INVALID_RANGE("Start date must be before end date"),
  EMPTY_CALENDAR("No valid days available for scheduling"),
  EMPTY_SUBJECT_SET("No subjects selected for scheduling"),
  EMPTY_ROOM_SET("No rooms selected for scheduling"),
  NO_COMPATIBLE_ROOM("No compatible room for subject"),
  INFEASIBLE("No feasible schedule found with the given constraints"),
  UNKNOWN("Solver budget exhausted before a schedule or a proof of infeasibility was found"),
  CANCELLED("Scheduling run was cancelled");

  private final String summary;

  SchedulingFailure(String summary) {
      this.summary = summary;
  }
}
