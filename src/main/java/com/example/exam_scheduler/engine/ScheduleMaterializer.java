package com.example.exam_scheduler.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.Subject;
import com.example.exam_scheduler.model.TimeWindow;
import com.example.exam_scheduler.solver.Assignment;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps a solved assignment back onto dates, rooms and exam times.
 */
@Slf4j
public class ScheduleMaterializer {
    static final Comparator<ScheduleItem> CHRONOLOGICAL =
        Comparator.comparing(ScheduleItem::getExamDate).thenComparing(ScheduleItem::getStartTime);

    /**
     * Returns one item per subject, ordered by exam date then start time.
     * Items that tie keep the subjects' input order.
     */
    public List<ScheduleItem> materialize(ExamModel model, Assignment assignment, SchedulingSettings settings) {
        if (assignment.size() != model.getSubjectCount()) {
            throw new IllegalArgumentException(String.format(
                "Assignment covers %d subjects but the model has %d", assignment.size(), model.getSubjectCount()));
        }

        List<ScheduleItem> items = new ArrayList<>(model.getSubjectCount());
        for (int i = 0; i < model.getSubjectCount(); i++) {
            Subject subject = model.getSubjects().get(i);
            int dayIdx = assignment.dayIndex(i);
            int roomIdx = assignment.roomIndex(i);
            if (dayIdx < 0 || dayIdx >= model.getDayCount() || roomIdx < 0 || roomIdx >= model.getRoomCount()) {
                throw new IllegalArgumentException(String.format(
                    "Assignment for %s out of range: day %d of %d, room %d of %d",
                    subject.describe(), dayIdx, model.getDayCount(), roomIdx, model.getRoomCount()));
            }

            LocalDate examDate = model.getDays().get(dayIdx);
            Room room = model.getRooms().get(roomIdx);
            TimeWindow window = settings.windowFor(subject.getKind());
            log.debug("{} -> {} in room {} at {}", subject.describe(), examDate, room.getName(), window.format());

            items.add(new ScheduleItem(subject, room, examDate, window.getStart(), window.getEnd()));
        }

        items.sort(CHRONOLOGICAL);
        return Collections.unmodifiableList(items);
    }
}
