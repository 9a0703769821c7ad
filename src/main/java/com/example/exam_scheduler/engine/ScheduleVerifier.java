package com.example.exam_scheduler.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.Subject;

/**
 * Checks a finished schedule against the rules it was built under. Returns
 * one message per violation; an empty list means the schedule is sound.
 */
public class ScheduleVerifier {

    public List<String> verify(List<Subject> subjects, List<ScheduleItem> items, List<LocalDate> days,
                               SchedulingSettings settings) {
        List<String> violations = new ArrayList<>();

        Map<Subject, Integer> placements = new IdentityHashMap<>();
        for (ScheduleItem item : items) {
            placements.merge(item.getSubject(), 1, Integer::sum);
        }
        for (Subject subject : subjects) {
            int count = placements.getOrDefault(subject, 0);
            if (count != 1) {
                violations.add(String.format("%s placed %d times", subject.describe(), count));
            }
        }
        if (items.size() != subjects.size()) {
            violations.add(String.format("%d items for %d subjects", items.size(), subjects.size()));
        }

        Map<LocalDate, Integer> dayIndex = new HashMap<>();
        for (int i = 0; i < days.size(); i++) {
            dayIndex.put(days.get(i), i);
        }

        for (ScheduleItem item : items) {
            if (!item.getSubject().getKind().accepts(item.getRoom().getKind())) {
                violations.add(String.format("%s (%s) placed in %s room %s",
                    item.getSubject().describe(), item.getSubject().getKind().getLabel(),
                    item.getRoom().getKind().getLabel(), item.getRoom().getName()));
            }
            if (!dayIndex.containsKey(item.getExamDate())) {
                violations.add(String.format("%s placed on %s, which is not an exam day",
                    item.getSubject().describe(), item.getExamDate()));
            }
        }

        for (int a = 0; a < items.size(); a++) {
            for (int b = a + 1; b < items.size(); b++) {
                ScheduleItem first = items.get(a);
                ScheduleItem second = items.get(b);

                // rooms are told apart by instance; two rooms may carry identical fields
                if (!settings.isAllowMultipleExamsPerSlot()
                        && first.getExamDate().equals(second.getExamDate())
                        && first.getRoom() == second.getRoom()) {
                    violations.add(String.format("%s and %s share room %s on %s",
                        first.getSubject().describe(), second.getSubject().describe(),
                        first.getRoom().getName(), first.getExamDate()));
                }

                Difficulty difficulty = first.getSubject().getDifficulty();
                int gapDays = settings.gapDaysFor(difficulty);
                if (gapDays > 0 && difficulty == second.getSubject().getDifficulty()) {
                    Integer firstDay = dayIndex.get(first.getExamDate());
                    Integer secondDay = dayIndex.get(second.getExamDate());
                    if (firstDay != null && secondDay != null && Math.abs(firstDay - secondDay) < gapDays) {
                        violations.add(String.format("%s exams %s and %s only %d exam days apart (need %d)",
                            difficulty.getLabel(), first.getSubject().describe(), second.getSubject().describe(),
                            Math.abs(firstDay - secondDay), gapDays));
                    }
                }
            }
        }
        return violations;
    }
}
