package com.example.exam_scheduler.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.exam_scheduler.engine.ExamModel.DayGap;
import com.example.exam_scheduler.engine.ExamModel.SlotExclusion;
import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.exceptions.SchedulingException;
import com.example.exam_scheduler.exceptions.SchedulingFailure;
import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.Subject;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the {@link ExamModel} for a set of subjects, rooms and exam days.
 * <ol>
 *   <li>room type: theory never in a lab, practical never in a classroom</li>
 *   <li>no two exams in the same room on the same day, unless the settings allow it</li>
 *   <li>hard/hard and medium/medium pairs kept the configured number of days apart</li>
 * </ol>
 * Mixed-difficulty pairs and pairs involving an easy exam get no gap.
 */
@Slf4j
public class ConstraintCompiler {
    private static final Difficulty[] SPACED_DIFFICULTIES = {Difficulty.HARD, Difficulty.MEDIUM};

    public ExamModel compile(List<Subject> subjects, List<Room> rooms, List<LocalDate> days,
                             SchedulingSettings settings) {
        if (subjects == null || rooms == null || days == null || settings == null) {
            throw new IllegalArgumentException("Subjects, rooms, days and settings are all required");
        }
        if (subjects.isEmpty()) {
            throw new SchedulingException(SchedulingFailure.EMPTY_SUBJECT_SET, "subject list is empty");
        }
        if (rooms.isEmpty()) {
            throw new SchedulingException(SchedulingFailure.EMPTY_ROOM_SET, "room list is empty");
        }
        if (days.isEmpty()) {
            throw new SchedulingException(SchedulingFailure.EMPTY_CALENDAR, "day list is empty");
        }

        List<Set<Integer>> forbiddenRooms = roomTypeConstraints(subjects, rooms);
        List<SlotExclusion> slotExclusions = settings.isAllowMultipleExamsPerSlot()
            ? Collections.emptyList()
            : noDoubleBookingConstraints(subjects.size());
        List<DayGap> dayGaps = difficultyGapConstraints(subjects, settings);

        ExamModel model = new ExamModel(
            List.copyOf(subjects),
            List.copyOf(rooms),
            List.copyOf(days),
            forbiddenRooms,
            slotExclusions,
            dayGaps);

        log.info("Compiled model: {} subjects, {} days, {} rooms | {} forbidden rooms, {} slot exclusions, {} day gaps",
            model.getSubjectCount(), model.getDayCount(), model.getRoomCount(),
            model.getForbiddenRoomCount(), slotExclusions.size(), dayGaps.size());
        return model;
    }

    private List<Set<Integer>> roomTypeConstraints(List<Subject> subjects, List<Room> rooms) {
        List<Set<Integer>> forbidden = new ArrayList<>(subjects.size());
        for (Subject subject : subjects) {
            Set<Integer> subjectForbidden = new HashSet<>();
            for (int roomIdx = 0; roomIdx < rooms.size(); roomIdx++) {
                if (!subject.getKind().accepts(rooms.get(roomIdx).getKind())) {
                    subjectForbidden.add(roomIdx);
                }
            }
            if (subjectForbidden.size() == rooms.size()) {
                throw SchedulingException.noCompatibleRoom(subject);
            }
            log.debug("{}: {} of {} rooms forbidden", subject.describe(), subjectForbidden.size(), rooms.size());
            forbidden.add(Collections.unmodifiableSet(subjectForbidden));
        }
        return Collections.unmodifiableList(forbidden);
    }

    private List<SlotExclusion> noDoubleBookingConstraints(int subjectCount) {
        List<SlotExclusion> exclusions = new ArrayList<>();
        for (int first = 0; first < subjectCount; first++) {
            for (int second = first + 1; second < subjectCount; second++) {
                exclusions.add(new SlotExclusion(first, second));
            }
        }
        return Collections.unmodifiableList(exclusions);
    }

    private List<DayGap> difficultyGapConstraints(List<Subject> subjects, SchedulingSettings settings) {
        Map<Difficulty, List<Integer>> byDifficulty = new EnumMap<>(Difficulty.class);
        for (int i = 0; i < subjects.size(); i++) {
            byDifficulty.computeIfAbsent(subjects.get(i).getDifficulty(), k -> new ArrayList<>()).add(i);
        }

        List<DayGap> gaps = new ArrayList<>();
        for (Difficulty difficulty : SPACED_DIFFICULTIES) {
            int gapDays = settings.gapDaysFor(difficulty);
            List<Integer> bucket = byDifficulty.getOrDefault(difficulty, Collections.emptyList());
            if (gapDays <= 0 || bucket.size() < 2) {
                continue;
            }
            for (int a = 0; a < bucket.size(); a++) {
                for (int b = a + 1; b < bucket.size(); b++) {
                    gaps.add(new DayGap(bucket.get(a), bucket.get(b), gapDays, difficulty));
                }
            }
            log.debug("{} {} exams spaced at least {} days apart", bucket.size(), difficulty, gapDays);
        }
        return Collections.unmodifiableList(gaps);
    }
}
