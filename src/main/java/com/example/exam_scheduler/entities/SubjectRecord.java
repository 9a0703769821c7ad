package com.example.exam_scheduler.entities;

import com.example.exam_scheduler.enums.Difficulty;
import com.example.exam_scheduler.enums.SubjectKind;
import com.example.exam_scheduler.model.Subject;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "subjects")
@Getter
@Setter
public class SubjectRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "code", nullable = false, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    // "Theory" or "Practical"
    @Column(name = "type", nullable = false, length = 20)
    private String type;

    @Column(name = "semester", nullable = false, length = 20)
    private String semester;

    @Column(name = "difficulty", nullable = false, length = 20)
    private String difficulty;

    @Column(name = "duration", nullable = false)
    private int duration;

    public Subject toSnapshot() {
        return Subject.builder()
            .id(id)
            .code(code)
            .name(name)
            .kind(SubjectKind.fromLabel(type))
            .semester(semester)
            .difficulty(Difficulty.fromLabel(difficulty))
            .durationMinutes(duration)
            .build();
    }
}
