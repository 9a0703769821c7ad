package com.example.exam_scheduler.solver;

import java.time.Duration;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Limits handed to the backend for one solve. Absent limits are not applied.
 */
@Value
public class SolveBudget {
    Duration timeLimit;
    Long maxConflicts;

    @Builder
    public SolveBudget(Duration timeLimit, Long maxConflicts) {
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new IllegalArgumentException("Time limit must be positive: " + timeLimit);
        }
        if (maxConflicts != null && maxConflicts <= 0) {
            throw new IllegalArgumentException("Conflict limit must be positive: " + maxConflicts);
        }
        this.timeLimit = timeLimit;
        this.maxConflicts = maxConflicts;
    }

    public static SolveBudget unlimited() {
        return new SolveBudget(null, null);
    }

    public static SolveBudget ofTimeLimit(Duration timeLimit) {
        return new SolveBudget(timeLimit, null);
    }

    public Optional<Duration> timeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    public Optional<Long> maxConflicts() {
        return Optional.ofNullable(maxConflicts);
    }
}
