package com.example.exam_scheduler.solver;

import java.util.Arrays;

/**
 * Raw solver answer: for subject {@code i} of the model, the index of its day
 * and the index of its room.
 */
public final class Assignment {
    private final int[] dayIndices;
    private final int[] roomIndices;

    public Assignment(int[] dayIndices, int[] roomIndices) {
        if (dayIndices.length != roomIndices.length) {
            throw new IllegalArgumentException(String.format(
                "Day and room index arrays differ in length (%d vs %d)", dayIndices.length, roomIndices.length));
        }
        this.dayIndices = dayIndices.clone();
        this.roomIndices = roomIndices.clone();
    }

    public int size() {
        return dayIndices.length;
    }

    public int dayIndex(int subject) {
        return dayIndices[subject];
    }

    public int roomIndex(int subject) {
        return roomIndices[subject];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment other = (Assignment) o;
        return Arrays.equals(dayIndices, other.dayIndices) && Arrays.equals(roomIndices, other.roomIndices);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dayIndices) + Arrays.hashCode(roomIndices);
    }

    @Override
    public String toString() {
        return "Assignment(days=" + Arrays.toString(dayIndices) + ", rooms=" + Arrays.toString(roomIndices) + ")";
    }
}
