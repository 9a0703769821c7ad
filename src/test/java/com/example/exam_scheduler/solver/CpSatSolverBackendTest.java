package com.example.exam_scheduler.solver;

import static com.example.exam_scheduler.Fixtures.MONDAY;
import static com.example.exam_scheduler.Fixtures.classroom;
import static com.example.exam_scheduler.Fixtures.lab;
import static com.example.exam_scheduler.Fixtures.practical;
import static com.example.exam_scheduler.Fixtures.theory;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.example.exam_scheduler.engine.ConstraintCompiler;
import com.example.exam_scheduler.engine.ExamModel;
import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.Subject;

class CpSatSolverBackendTest {
    private static final SolveBudget BUDGET = SolveBudget.ofTimeLimit(Duration.ofSeconds(20));

    private static CpSatSolverBackend backend;
    private static ExecutorService solving;
    private final ConstraintCompiler compiler = new ConstraintCompiler();

    @BeforeAll
    static void loadSolver() {
        backend = new CpSatSolverBackend(2, false);
        solving = Executors.newSingleThreadExecutor();
    }

    @AfterAll
    static void stopSolving() {
        solving.shutdownNow();
    }

    /**
     * Hard exams spaced {@code gapDays} apart over {@code days} exam days, one room.
     * Feasible only when {@code days >= (count - 1) * gapDays + 1}.
     */
    private ExamModel packedHardExams(int count, int gapDays, int days) {
        List<Subject> subjects = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            subjects.add(theory(i, Difficulty.HARD));
        }
        return compiler.compile(subjects, List.of(classroom(1)), weekdays(days),
            SchedulingSettings.builder().hardGapDays(gapDays).build());
    }

    private static List<LocalDate> weekdays(int count) {
        List<LocalDate> days = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            days.add(MONDAY.plusDays(i));
        }
        return days;
    }

    @Test
    void roomTypesAreRespected() {
        List<Subject> subjects = List.of(
            theory(1, Difficulty.EASY), practical(2, Difficulty.EASY),
            theory(3, Difficulty.EASY), practical(4, Difficulty.EASY));
        List<Room> rooms = List.of(lab(1), classroom(2), lab(3), classroom(4));
        ExamModel model = compiler.compile(subjects, rooms, weekdays(1), SchedulingSettings.defaults());

        SolveResult result = backend.solve(model, BUDGET, new CancellationSignal());

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SATISFIED);
        Assignment assignment = result.getAssignment().orElseThrow();
        for (int i = 0; i < subjects.size(); i++) {
            assertThat(subjects.get(i).getKind().accepts(rooms.get(assignment.roomIndex(i)).getKind())).isTrue();
            assertThat(assignment.dayIndex(i)).isZero();
        }
    }

    @Test
    void oneDaySeveralRoomsGivesDistinctRooms() {
        List<Subject> subjects = List.of(
            theory(1, Difficulty.EASY), theory(2, Difficulty.EASY), theory(3, Difficulty.EASY));
        ExamModel model = compiler.compile(subjects, List.of(classroom(1), classroom(2), classroom(3)), weekdays(1),
            SchedulingSettings.defaults());

        Assignment assignment = backend.solve(model, BUDGET, new CancellationSignal()).getAssignment().orElseThrow();

        Set<Integer> rooms = new HashSet<>();
        for (int i = 0; i < subjects.size(); i++) {
            rooms.add(assignment.roomIndex(i));
        }
        assertThat(rooms).hasSize(3);
    }

    @Test
    void sharingASlotIsFineWhenAllowed() {
        List<Subject> subjects = List.of(
            theory(1, Difficulty.EASY), theory(2, Difficulty.EASY), theory(3, Difficulty.EASY));
        SchedulingSettings settings = SchedulingSettings.builder().allowMultipleExamsPerSlot(true).build();
        ExamModel model = compiler.compile(subjects, List.of(classroom(1)), weekdays(1), settings);

        assertThat(backend.solve(model, BUDGET, new CancellationSignal()).getStatus())
            .isEqualTo(SolveStatus.SATISFIED);
    }

    @Test
    void hardExamsAreSpaced() {
        List<Subject> subjects = List.of(
            theory(1, Difficulty.HARD), theory(2, Difficulty.HARD), theory(3, Difficulty.HARD));
        SchedulingSettings settings = SchedulingSettings.builder()
            .allowMultipleExamsPerSlot(true).hardGapDays(2).build();
        ExamModel model = compiler.compile(subjects, List.of(classroom(1)), weekdays(5), settings);

        Assignment assignment = backend.solve(model, BUDGET, new CancellationSignal()).getAssignment().orElseThrow();

        for (int a = 0; a < 3; a++) {
            for (int b = a + 1; b < 3; b++) {
                assertThat(Math.abs(assignment.dayIndex(a) - assignment.dayIndex(b))).isGreaterThanOrEqualTo(2);
            }
        }
    }

    @Test
    void tooManyHardExamsForTheWindowIsInfeasible() {
        List<Subject> subjects = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            subjects.add(theory(i, Difficulty.HARD));
        }
        SchedulingSettings settings = SchedulingSettings.builder().hardGapDays(2).build();
        ExamModel model = compiler.compile(subjects, List.of(classroom(1)), weekdays(3), settings);

        SolveResult result = backend.solve(model, BUDGET, new CancellationSignal());

        assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.getAssignment()).isEmpty();
    }

    @Test
    void cancelledBeforeSolvingReportsUnknown() {
        ExamModel model = compiler.compile(List.of(theory(1, Difficulty.EASY)), List.of(classroom(1)), weekdays(1),
            SchedulingSettings.defaults());
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        assertThat(backend.solve(model, BUDGET, cancellation).getStatus()).isEqualTo(SolveStatus.UNKNOWN);
    }

    @Test
    void exhaustedBudgetIsUnknownEvenThoughASolutionExists() {
        ExamModel model = packedHardExams(60, 3, 59 * 3 + 1);
        SolveBudget tiny = SolveBudget.builder().timeLimit(Duration.ofMillis(1)).maxConflicts(1L).build();

        SolveResult result = backend.solve(model, tiny, new CancellationSignal());

        assertThat(result.getStatus()).isEqualTo(SolveStatus.UNKNOWN);
        assertThat(result.getAssignment()).isEmpty();
    }

    @Test
    void cancelStopsARunningSolve() throws Exception {
        // one day short of fitting, so nothing ends this solve except a proof or the cancel
        ExamModel model = packedHardExams(40, 3, 39 * 3);
        CancellationSignal cancellation = new CancellationSignal();

        Future<SolveResult> result = solving.submit(() -> backend.solve(model, SolveBudget.unlimited(), cancellation));
        Thread.sleep(300);
        cancellation.cancel();

        assertThat(result.get(30, TimeUnit.SECONDS).getStatus()).isIn(SolveStatus.UNKNOWN, SolveStatus.INFEASIBLE);
    }

    @Test
    void cancelRacingTheStartOfSolveIsNotLost() throws Exception {
        ExamModel model = packedHardExams(40, 3, 39 * 3);

        for (int round = 0; round < 20; round++) {
            CancellationSignal cancellation = new CancellationSignal();
            Future<SolveResult> result =
                solving.submit(() -> backend.solve(model, SolveBudget.unlimited(), cancellation));
            // lands anywhere between model setup and the native search
            Thread.sleep(round % 5);
            cancellation.cancel();

            assertThat(result.get(30, TimeUnit.SECONDS).getStatus())
                .as("round %d", round)
                .isIn(SolveStatus.UNKNOWN, SolveStatus.INFEASIBLE);
        }
    }
}
