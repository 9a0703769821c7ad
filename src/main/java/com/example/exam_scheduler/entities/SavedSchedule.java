package com.example.exam_scheduler.entities;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * An archived scheduling run together with the settings it was built under.
 */
@Getter
@Setter
@Entity
@Table(name = "schedules")
public class SavedSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "semester", length = 20)
    private String semester;

    @Column(name = "exam_type", nullable = false, length = 20)
    private String examType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "allow_multiple_exams", nullable = false)
    private boolean allowMultipleExams;

    @Column(name = "hard_gap", nullable = false)
    private int hardGapDays;

    @Column(name = "medium_gap", nullable = false)
    private int mediumGapDays;

    @Column(name = "theory_time", nullable = false, length = 40)
    private String theoryWindow;

    @Column(name = "practical_time", nullable = false, length = 40)
    private String practicalWindow;

    @OrderBy("examDate ASC, id ASC")
    @OneToMany(mappedBy = "schedule", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<SavedScheduleItem> items = new ArrayList<>();

    public void addItem(SavedScheduleItem item) {
        item.setSchedule(this);
        items.add(item);
    }
}
