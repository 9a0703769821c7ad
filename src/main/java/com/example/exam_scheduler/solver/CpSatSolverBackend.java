package com.example.exam_scheduler.solver;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.example.exam_scheduler.engine.ExamModel;
import com.example.exam_scheduler.engine.ExamModel.DayGap;
import com.example.exam_scheduler.engine.ExamModel.SlotExclusion;
import com.example.exam_scheduler.model.Subject;
import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;

import lombok.extern.slf4j.Slf4j;

/**
 * Solves an {@link ExamModel} with OR-Tools CP-SAT. No objective is set, so
 * the first solution CP-SAT reports is taken, whether it calls it optimal or
 * merely feasible.
 */
@Slf4j
public class CpSatSolverBackend implements SolverBackend {
    private static final long STOP_RETRY_MILLIS = 20;

    private final int numSearchWorkers;
    private final boolean logSearchProgress;

    public CpSatSolverBackend(int numSearchWorkers, boolean logSearchProgress) {
        if (numSearchWorkers < 1) {
            throw new IllegalArgumentException("Need at least one search worker, got " + numSearchWorkers);
        }
        Loader.loadNativeLibraries();
        this.numSearchWorkers = numSearchWorkers;
        this.logSearchProgress = logSearchProgress;
    }

    @Override
    public SolveResult solve(ExamModel model, SolveBudget budget, CancellationSignal cancellation) {
        CpModel cpModel = new CpModel();
        int n = model.getSubjectCount();
        IntVar[] subjectDay = new IntVar[n];
        IntVar[] subjectRoom = new IntVar[n];

        for (int i = 0; i < n; i++) {
            Subject subject = model.getSubjects().get(i);
            subjectDay[i] = cpModel.newIntVar(0, model.getDayCount() - 1, "subject_" + subject.getId() + "_day");
            subjectRoom[i] = cpModel.newIntVar(0, model.getRoomCount() - 1, "subject_" + subject.getId() + "_room");
        }

        // Room type
        for (int i = 0; i < n; i++) {
            for (int roomIdx : model.forbiddenRoomsOf(i)) {
                cpModel.addDifferent(subjectRoom[i], roomIdx);
            }
        }

        // Same day and same room never together
        for (SlotExclusion exclusion : model.getSlotExclusions()) {
            int a = exclusion.getFirst();
            int b = exclusion.getSecond();
            BoolVar dayDiffers = cpModel.newBoolVar("day_differs_" + a + "_" + b);
            BoolVar roomDiffers = cpModel.newBoolVar("room_differs_" + a + "_" + b);
            cpModel.addDifferent(subjectDay[a], subjectDay[b]).onlyEnforceIf(dayDiffers);
            cpModel.addDifferent(subjectRoom[a], subjectRoom[b]).onlyEnforceIf(roomDiffers);
            cpModel.addBoolOr(new Literal[] {dayDiffers, roomDiffers});
        }

        // Either a is at least gap days before b, or b before a
        for (DayGap gap : model.getDayGaps()) {
            int a = gap.getFirst();
            int b = gap.getSecond();
            BoolVar firstGoesFirst = cpModel.newBoolVar("gap_" + a + "_" + b);
            cpModel.addLessOrEqual(plusDays(subjectDay[a], gap.getGapDays()), subjectDay[b])
                .onlyEnforceIf(firstGoesFirst);
            cpModel.addLessOrEqual(plusDays(subjectDay[b], gap.getGapDays()), subjectDay[a])
                .onlyEnforceIf(firstGoesFirst.not());
        }

        CpSolver solver = new CpSolver();
        solver.getParameters().setNumSearchWorkers(numSearchWorkers);
        solver.getParameters().setLogSearchProgress(logSearchProgress);
        budget.timeLimit().ifPresent(limit -> solver.getParameters().setMaxTimeInSeconds(limit.toMillis() / 1000.0));
        budget.maxConflicts().ifPresent(limit -> solver.getParameters().setMaxNumberOfConflicts(limit));

        log.info("Solving with CP-SAT: {} subjects, {} workers, time limit {}, conflict limit {}",
            n, numSearchWorkers,
            budget.timeLimit().map(Object::toString).orElse("none"),
            budget.maxConflicts().map(Object::toString).orElse("none"));

        // stopSearch() is a no-op until solve() has set up its native wrapper, so keep
        // stopping until the solve returns
        CountDownLatch finished = new CountDownLatch(1);
        cancellation.onCancel(() -> CompletableFuture.runAsync(() -> stopUntilFinished(solver, finished)));
        CpSolverStatus status;
        try {
            if (cancellation.isCancelled()) {
                return SolveResult.unknown("CANCELLED", 0.0);
            }
            status = solver.solve(cpModel);
        } finally {
            finished.countDown();
            cancellation.clear();
        }
        double wallTime = solver.wallTime();
        log.info("CP-SAT finished with {} after {}s ({} conflicts, {} branches)",
            status, wallTime, solver.numConflicts(), solver.numBranches());

        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                int[] days = new int[n];
                int[] rooms = new int[n];
                for (int i = 0; i < n; i++) {
                    days[i] = (int) solver.value(subjectDay[i]);
                    rooms[i] = (int) solver.value(subjectRoom[i]);
                }
                return SolveResult.satisfied(new Assignment(days, rooms), status.name(), wallTime);
            case INFEASIBLE:
                return SolveResult.infeasible(status.name(), wallTime);
            case UNKNOWN:
                return SolveResult.unknown(status.name(), wallTime);
            default:
                throw new IllegalStateException("CP-SAT rejected the exam model (" + status + "): "
                    + solver.response().getSolutionInfo());
        }
    }

    private static void stopUntilFinished(CpSolver solver, CountDownLatch finished) {
        try {
            do {
                solver.stopSearch();
            } while (!finished.await(STOP_RETRY_MILLIS, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static LinearExpr plusDays(IntVar day, long days) {
        return LinearExpr.newBuilder().add(day).add(days).build();
    }
}
