package com.example.exam_scheduler.services;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.example.exam_scheduler.config.SchedulerProperties;
import com.example.exam_scheduler.engine.CalendarBuilder;
import com.example.exam_scheduler.engine.ConstraintCompiler;
import com.example.exam_scheduler.engine.ExamModel;
import com.example.exam_scheduler.engine.ScheduleMaterializer;
import com.example.exam_scheduler.engine.ScheduleVerifier;
import com.example.exam_scheduler.exceptions.SchedulingException;
import com.example.exam_scheduler.exceptions.SchedulingFailure;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingRequest;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.solver.CancellationSignal;
import com.example.exam_scheduler.solver.SolveBudget;
import com.example.exam_scheduler.solver.SolveResult;
import com.example.exam_scheduler.solver.SolverBackend;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs calendar, compiler, solver and materializer for one request.
 * Holds no per-run state, so runs may proceed in parallel.
 */
@Slf4j
@Service
public class ExamSchedulingService {
    private final CalendarBuilder calendarBuilder;
    private final ConstraintCompiler compiler;
    private final SolverBackend solverBackend;
    private final ScheduleMaterializer materializer;
    private final ScheduleVerifier verifier;
    private final SolveBudget defaultBudget;
    private final SchedulingSettings defaultSettings;
    private final Executor executor;

    public ExamSchedulingService(CalendarBuilder calendarBuilder, ConstraintCompiler compiler,
                                 SolverBackend solverBackend, ScheduleMaterializer materializer,
                                 ScheduleVerifier verifier, SchedulerProperties properties,
                                 @Qualifier("schedulingExecutor") Executor executor) {
        this.calendarBuilder = calendarBuilder;
        this.compiler = compiler;
        this.solverBackend = solverBackend;
        this.materializer = materializer;
        this.verifier = verifier;
        this.defaultBudget = properties.getSolver().toBudget();
        this.defaultSettings = properties.getDefaults().toSettings();
        this.executor = executor;
    }

    public List<ScheduleItem> generate(SchedulingRequest request) {
        return run(request, new CancellationSignal());
    }

    public SchedulingJob submit(SchedulingRequest request) {
        CancellationSignal cancellation = new CancellationSignal();
        CompletableFuture<List<ScheduleItem>> result =
            CompletableFuture.supplyAsync(() -> run(request, cancellation), executor);
        return new SchedulingJob(result, cancellation);
    }

    List<ScheduleItem> run(SchedulingRequest request, CancellationSignal cancellation) {
        if (request == null) {
            throw new IllegalArgumentException("Scheduling request cannot be null");
        }
        try {
            List<LocalDate> days = calendarBuilder.build(request.getWindow());
            SchedulingSettings settings = request.getSettings() != null ? request.getSettings() : defaultSettings;
            ExamModel model = compiler.compile(request.getSubjects(), request.getRooms(), days, settings);
            SolveBudget budget = request.getBudget() != null ? request.getBudget() : defaultBudget;

            throwIfCancelled(cancellation);
            SolveResult result = solverBackend.solve(model, budget, cancellation);
            throwIfCancelled(cancellation);

            switch (result.getStatus()) {
                case INFEASIBLE:
                    throw new SchedulingException(SchedulingFailure.INFEASIBLE, String.format(
                        "%d subjects over %d days in %d rooms", model.getSubjectCount(), model.getDayCount(),
                        model.getRoomCount()));
                case UNKNOWN:
                    throw new SchedulingException(SchedulingFailure.UNKNOWN, String.format(
                        "backend reported %s after %.2fs", result.getBackendStatus(), result.getWallTimeSeconds()));
                default:
                    break;
            }

            List<ScheduleItem> items = materializer.materialize(
                model, result.getAssignment().orElseThrow(), settings);
            List<String> violations = verifier.verify(model.getSubjects(), items, days, settings);
            if (!violations.isEmpty()) {
                throw new IllegalStateException("Solver returned a schedule that breaks its constraints: " + violations);
            }

            log.info("Scheduled {} exams between {} and {}", items.size(),
                items.get(0).getExamDate(), items.get(items.size() - 1).getExamDate());
            return items;
        } catch (SchedulingException e) {
            log.warn("Scheduling failed [{}]: {}", e.getFailure(), e.getMessage());
            throw e;
        }
    }

    private static void throwIfCancelled(CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            throw new SchedulingException(SchedulingFailure.CANCELLED, "partial work discarded");
        }
    }
}
