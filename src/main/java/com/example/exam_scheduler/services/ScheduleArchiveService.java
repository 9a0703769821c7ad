package com.example.exam_scheduler.services;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.exam_scheduler.entities.SavedSchedule;
import com.example.exam_scheduler.entities.SavedScheduleItem;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.repositories.SavedScheduleRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores accepted schedules as a {@code schedules} row plus one
 * {@code schedule_items} row per exam.
 */
@Slf4j
@Service
public class ScheduleArchiveService {
    private final SavedScheduleRepository scheduleRepo;

    public ScheduleArchiveService(SavedScheduleRepository scheduleRepo) {
        this.scheduleRepo = scheduleRepo;
    }

    /**
     * Saves a schedule under {@code name}. A schedule already stored under
     * that name is overwritten, items included.
     */
    @Transactional
    public SavedSchedule save(String name, String semester, String examType, SchedulingSettings settings,
                              List<ScheduleItem> items) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schedule name cannot be blank");
        }
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot save an empty schedule");
        }

        SavedSchedule schedule = scheduleRepo.findByName(name.trim()).orElseGet(SavedSchedule::new);
        if (schedule.getId() != null) {
            log.info("Overwriting schedule '{}' (id {}, {} items)", schedule.getName(), schedule.getId(),
                schedule.getItems().size());
            schedule.getItems().clear();
        }

        LocalDate startDate = items.stream()
            .map(ScheduleItem::getExamDate)
            .min(Comparator.naturalOrder())
            .orElseThrow();

        schedule.setName(name.trim());
        schedule.setSemester(semester);
        schedule.setExamType(examType);
        schedule.setStartDate(startDate);
        schedule.setAllowMultipleExams(settings.isAllowMultipleExamsPerSlot());
        schedule.setHardGapDays(settings.getHardGapDays());
        schedule.setMediumGapDays(settings.getMediumGapDays());
        schedule.setTheoryWindow(settings.getTheoryWindow().format());
        schedule.setPracticalWindow(settings.getPracticalWindow().format());

        for (ScheduleItem item : items) {
            SavedScheduleItem row = new SavedScheduleItem();
            row.setSubjectId(item.getSubject().getId());
            row.setRoomId(item.getRoom().getId());
            row.setExamDate(item.getExamDate());
            row.setStartTime(item.formattedStartTime());
            row.setEndTime(item.formattedEndTime());
            schedule.addItem(row);
        }

        SavedSchedule saved = scheduleRepo.save(schedule);
        log.info("Saved schedule '{}' with {} items starting {}", saved.getName(), items.size(), startDate);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<SavedSchedule> findByName(String name) {
        return scheduleRepo.findByName(name);
    }

    @Transactional
    public void delete(Long id) {
        SavedSchedule schedule = scheduleRepo.findById(id)
            .orElseThrow(() -> new IllegalArgumentException("Schedule not found with ID: " + id));
        scheduleRepo.delete(schedule);
        log.info("Deleted schedule '{}' (id {})", schedule.getName(), id);
    }
}
