package com.example.exam_scheduler.solver;

import com.example.exam_scheduler.engine.ExamModel;

/**
 * A finite-domain constraint engine that can answer a compiled exam model.
 * Implementations must return within the budget, map an exhausted budget to
 * {@link SolveStatus#UNKNOWN} and stop searching when the signal is cancelled.
 */
public interface SolverBackend {
    SolveResult solve(ExamModel model, SolveBudget budget, CancellationSignal cancellation);
}
