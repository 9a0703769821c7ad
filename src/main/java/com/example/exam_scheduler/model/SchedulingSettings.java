package com.example.exam_scheduler.model;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.enums.SubjectKind;

import lombok.Builder;
import lombok.Value;

/**
 * Rules for one scheduling run. Every field is resolved when the object is
 * built; unset builder fields take the defaults below.
 */
@Value
public class SchedulingSettings {
    public static final int DEFAULT_HARD_GAP_DAYS = 1;
    public static final int DEFAULT_MEDIUM_GAP_DAYS = 0;
    public static final TimeWindow DEFAULT_THEORY_WINDOW = TimeWindow.parse("09:00 AM - 12:00 PM");
    public static final TimeWindow DEFAULT_PRACTICAL_WINDOW = TimeWindow.parse("02:00 PM - 05:00 PM");

    boolean allowMultipleExamsPerSlot;
    int hardGapDays;
    int mediumGapDays;
    TimeWindow theoryWindow;
    TimeWindow practicalWindow;

    @Builder
    private SchedulingSettings(Boolean allowMultipleExamsPerSlot, Integer hardGapDays, Integer mediumGapDays,
                               TimeWindow theoryWindow, TimeWindow practicalWindow) {
        this.allowMultipleExamsPerSlot = allowMultipleExamsPerSlot != null && allowMultipleExamsPerSlot;
        this.hardGapDays = hardGapDays != null ? hardGapDays : DEFAULT_HARD_GAP_DAYS;
        this.mediumGapDays = mediumGapDays != null ? mediumGapDays : DEFAULT_MEDIUM_GAP_DAYS;
        this.theoryWindow = theoryWindow != null ? theoryWindow : DEFAULT_THEORY_WINDOW;
        this.practicalWindow = practicalWindow != null ? practicalWindow : DEFAULT_PRACTICAL_WINDOW;

        if (this.hardGapDays < 0 || this.mediumGapDays < 0) {
            throw new IllegalArgumentException(String.format(
                "Gap days must not be negative (hard=%d, medium=%d)", this.hardGapDays, this.mediumGapDays));
        }
    }

    public static SchedulingSettings defaults() {
        return builder().build();
    }

    public TimeWindow windowFor(SubjectKind kind) {
        return kind == SubjectKind.THEORY ? theoryWindow : practicalWindow;
    }

    /**
     * Minimum distance, in eligible days, between two exams that share this
     * difficulty. Easy exams are never spaced.
     */
    public int gapDaysFor(Difficulty difficulty) {
        switch (difficulty) {
            case HARD:
                return hardGapDays;
            case MEDIUM:
                return mediumGapDays;
            default:
                return 0;
        }
    }
}
