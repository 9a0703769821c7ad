package com.example.exam_scheduler;

import java.time.LocalDate;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.enums.RoomKind;
import com.example.exam_scheduler.enums.SubjectKind;
import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.Subject;

public final class Fixtures {
    // Saturday 17 May 2025; the 18th is a Sunday
    public static final LocalDate SATURDAY = LocalDate.of(2025, 5, 17);
    public static final LocalDate SUNDAY = LocalDate.of(2025, 5, 18);
    public static final LocalDate MONDAY = LocalDate.of(2025, 5, 19);

    private Fixtures() {
    }

    public static Subject theory(long id, Difficulty difficulty) {
        return subject(id, SubjectKind.THEORY, difficulty);
    }

    public static Subject practical(long id, Difficulty difficulty) {
        return subject(id, SubjectKind.PRACTICAL, difficulty);
    }

    public static Subject subject(long id, SubjectKind kind, Difficulty difficulty) {
        return Subject.builder()
            .id(id)
            .code("C" + id)
            .name("Subject " + id)
            .kind(kind)
            .semester("2")
            .difficulty(difficulty)
            .durationMinutes(120)
            .build();
    }

    public static Room classroom(long id) {
        return room(id, RoomKind.CLASSROOM);
    }

    public static Room lab(long id) {
        return room(id, RoomKind.LAB);
    }

    public static Room room(long id, RoomKind kind) {
        return Room.builder()
            .id(id)
            .name(String.valueOf(100 + id))
            .kind(kind)
            .capacity(30)
            .build();
    }
}
