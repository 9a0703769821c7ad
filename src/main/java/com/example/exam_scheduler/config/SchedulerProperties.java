package com.example.exam_scheduler.config;

import java.time.Duration;
import java.time.LocalDate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.TimeWindow;
import com.example.exam_scheduler.solver.SolveBudget;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "exam-scheduler")
public class SchedulerProperties {
    private Solver solver = new Solver();
    private Defaults defaults = new Defaults();
    private Executor executor = new Executor();
    private Startup startup = new Startup();

    @Getter
    @Setter
    public static class Solver {
        private Duration timeLimit = Duration.ofSeconds(60);
        private Long maxConflicts;
        private int numWorkers = 8;
        private boolean logSearchProgress = false;

        public SolveBudget toBudget() {
            return new SolveBudget(timeLimit, maxConflicts);
        }
    }

    @Getter
    @Setter
    public static class Defaults {
        private boolean allowMultipleExamsPerSlot = false;
        private int hardGapDays = SchedulingSettings.DEFAULT_HARD_GAP_DAYS;
        private int mediumGapDays = SchedulingSettings.DEFAULT_MEDIUM_GAP_DAYS;
        private String theoryWindow = SchedulingSettings.DEFAULT_THEORY_WINDOW.format();
        private String practicalWindow = SchedulingSettings.DEFAULT_PRACTICAL_WINDOW.format();

        public SchedulingSettings toSettings() {
            return SchedulingSettings.builder()
                .allowMultipleExamsPerSlot(allowMultipleExamsPerSlot)
                .hardGapDays(hardGapDays)
                .mediumGapDays(mediumGapDays)
                .theoryWindow(TimeWindow.parse(theoryWindow))
                .practicalWindow(TimeWindow.parse(practicalWindow))
                .build();
        }
    }

    @Getter
    @Setter
    public static class Executor {
        private int poolSize = 2;
    }

    @Getter
    @Setter
    public static class Startup {
        private boolean enabled = false;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate startDate;
        private int spanDays = 14;
        // null or blank schedules every stored subject
        private String semester;
        private String scheduleName = "Generated schedule";
        private String examType = "Regular";
    }
}
