package com.example.exam_scheduler.engine;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.Subject;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

/**
 * Finite-domain model of one scheduling run, independent of any solver.
 * <p>
 * Subject {@code i} owns a day variable over {@code [0, days-1]} and a room
 * variable over {@code [0, rooms-1]}. Constraints are kept as plain data:
 * forbidden rooms per subject, pairs that may not share a (day, room) slot,
 * and pairs whose days must be at least a number of days apart.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class ExamModel {
    private final List<Subject> subjects;
    private final List<Room> rooms;
    private final List<LocalDate> days;
    // indexed by subject
    private final List<Set<Integer>> forbiddenRooms;
    private final List<SlotExclusion> slotExclusions;
    private final List<DayGap> dayGaps;

    public int getSubjectCount() {
        return subjects.size();
    }

    public int getDayCount() {
        return days.size();
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public Set<Integer> forbiddenRoomsOf(int subject) {
        return forbiddenRooms.get(subject);
    }

    public int getForbiddenRoomCount() {
        return forbiddenRooms.stream().mapToInt(Set::size).sum();
    }

    /** Subjects {@code first} and {@code second} must differ in day or in room. */
    @Value
    public static class SlotExclusion {
        int first;
        int second;
    }

    /** {@code |day(first) - day(second)| >= gapDays}. */
    @Value
    public static class DayGap {
        int first;
        int second;
        int gapDays;
        Difficulty difficulty;
    }
}
