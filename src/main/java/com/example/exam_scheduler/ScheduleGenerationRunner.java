package com.example.exam_scheduler;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.example.exam_scheduler.config.SchedulerProperties;
import com.example.exam_scheduler.entities.RoomRecord;
import com.example.exam_scheduler.entities.SubjectRecord;
import com.example.exam_scheduler.model.CalendarWindow;
import com.example.exam_scheduler.model.Room;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingRequest;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.model.Subject;
import com.example.exam_scheduler.repositories.RoomRepository;
import com.example.exam_scheduler.repositories.SubjectRepository;
import com.example.exam_scheduler.services.ExamSchedulingService;
import com.example.exam_scheduler.services.ScheduleArchiveService;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates and archives a schedule from the stored subjects and rooms when
 * the application starts. Off unless {@code exam-scheduler.startup.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "exam-scheduler.startup", name = "enabled", havingValue = "true")
public class ScheduleGenerationRunner implements CommandLineRunner {
    private final SubjectRepository subjectRepo;
    private final RoomRepository roomRepo;
    private final ExamSchedulingService schedulingService;
    private final ScheduleArchiveService archiveService;
    private final SchedulerProperties properties;

    public ScheduleGenerationRunner(SubjectRepository subjectRepo, RoomRepository roomRepo,
                                    ExamSchedulingService schedulingService, ScheduleArchiveService archiveService,
                                    SchedulerProperties properties) {
        this.subjectRepo = subjectRepo;
        this.roomRepo = roomRepo;
        this.schedulingService = schedulingService;
        this.archiveService = archiveService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        SchedulerProperties.Startup startup = properties.getStartup();
        LocalDate startDate = startup.getStartDate() != null ? startup.getStartDate() : LocalDate.now();

        List<Subject> subjects = subjectRepo.fetchBySemester(startup.getSemester()).stream()
            .map(SubjectRecord::toSnapshot)
            .collect(Collectors.toList());
        List<Room> rooms = roomRepo.fetchAll().stream()
            .map(RoomRecord::toSnapshot)
            .collect(Collectors.toList());
        log.info("Loaded {} subjects (semester {}) and {} rooms", subjects.size(),
            startup.getSemester() == null ? "any" : startup.getSemester(), rooms.size());

        SchedulingSettings settings = properties.getDefaults().toSettings();
        SchedulingRequest request = SchedulingRequest.builder()
            .subjects(subjects)
            .rooms(rooms)
            .window(CalendarWindow.startingAt(startDate, startup.getSpanDays()))
            .settings(settings)
            .build();

        List<ScheduleItem> items = schedulingService.generate(request);
        for (ScheduleItem item : items) {
            log.info("{} | {} - {} | {} {} | room {}",
                item.getExamDate(), item.formattedStartTime(), item.formattedEndTime(),
                item.getSubject().getCode(), item.getSubject().getName(), item.getRoom().getName());
        }

        archiveService.save(startup.getScheduleName(), startup.getSemester(), startup.getExamType(), settings, items);
    }
}
