package com.example.exam_scheduler.solver;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SolveResult {
    SolveStatus status;
    Assignment assignment;
    // status name reported by the backend itself, for logging
    String backendStatus;
    double wallTimeSeconds;

    public static SolveResult satisfied(Assignment assignment, String backendStatus, double wallTimeSeconds) {
        if (assignment == null) {
            throw new IllegalArgumentException("A satisfied result needs an assignment");
        }
        return new SolveResult(SolveStatus.SATISFIED, assignment, backendStatus, wallTimeSeconds);
    }

    public static SolveResult infeasible(String backendStatus, double wallTimeSeconds) {
        return new SolveResult(SolveStatus.INFEASIBLE, null, backendStatus, wallTimeSeconds);
    }

    public static SolveResult unknown(String backendStatus, double wallTimeSeconds) {
        return new SolveResult(SolveStatus.UNKNOWN, null, backendStatus, wallTimeSeconds);
    }

    public Optional<Assignment> getAssignment() {
        return Optional.ofNullable(assignment);
    }
}
