package com.example.exam_scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.example.exam_scheduler.config.SchedulerProperties;
import com.example.exam_scheduler.entities.RoomRecord;
import com.example.exam_scheduler.entities.SubjectRecord;
import com.example.exam_scheduler.exceptions.SchedulingException;
import com.example.exam_scheduler.exceptions.SchedulingFailure;
import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.model.SchedulingRequest;
import com.example.exam_scheduler.model.SchedulingSettings;
import com.example.exam_scheduler.repositories.RoomRepository;
import com.example.exam_scheduler.repositories.SubjectRepository;
import com.example.exam_scheduler.services.ExamSchedulingService;
import com.example.exam_scheduler.services.ScheduleArchiveService;

class ScheduleGenerationRunnerTest {
    private SubjectRepository subjectRepo;
    private RoomRepository roomRepo;
    private ExamSchedulingService schedulingService;
    private ScheduleArchiveService archiveService;
    private SchedulerProperties properties;
    private ScheduleGenerationRunner runner;

    @BeforeEach
    void setUp() {
        subjectRepo = mock(SubjectRepository.class);
        roomRepo = mock(RoomRepository.class);
        schedulingService = mock(ExamSchedulingService.class);
        archiveService = mock(ScheduleArchiveService.class);
        properties = new SchedulerProperties();
        properties.getStartup().setStartDate(LocalDate.of(2025, 5, 19));
        properties.getStartup().setSemester("3");
        properties.getStartup().setScheduleName("Spring finals");
        runner = new ScheduleGenerationRunner(subjectRepo, roomRepo, schedulingService, archiveService, properties);

        SubjectRecord subject = new SubjectRecord();
        subject.setId(7L);
        subject.setCode("CS301");
        subject.setName("Compilers");
        subject.setType("Theory");
        subject.setSemester("3");
        subject.setDifficulty("Hard");
        subject.setDuration(180);
        RoomRecord room = new RoomRecord();
        room.setId(3L);
        room.setName("B-12");
        room.setType("Classroom");
        room.setCapacity(40);
        when(subjectRepo.fetchBySemester("3")).thenReturn(List.of(subject));
        when(roomRepo.fetchAll()).thenReturn(List.of(room));
    }

    @Test
    void generatesFromStoredDataAndArchives() {
        when(schedulingService.generate(any())).thenAnswer(invocation -> {
            SchedulingRequest r = invocation.getArgument(0);
            return List.of(new ScheduleItem(r.getSubjects().get(0), r.getRooms().get(0),
                r.getWindow().getStartDate(), LocalTime.of(9, 0), LocalTime.of(12, 0)));
        });

        runner.run();

        ArgumentCaptor<SchedulingRequest> request = ArgumentCaptor.forClass(SchedulingRequest.class);
        verify(schedulingService).generate(request.capture());
        SchedulingRequest sent = request.getValue();
        assertThat(sent.getSubjects()).extracting(s -> s.getCode()).containsExactly("CS301");
        assertThat(sent.getRooms()).extracting(r -> r.getName()).containsExactly("B-12");
        assertThat(sent.getWindow().getStartDate()).isEqualTo(LocalDate.of(2025, 5, 19));
        assertThat(sent.getWindow().getEndDate()).isEqualTo(LocalDate.of(2025, 6, 2));
        assertThat(sent.getSettings()).isEqualTo(SchedulingSettings.defaults());
        verify(archiveService).save(eq("Spring finals"), eq("3"), eq("Regular"), eq(SchedulingSettings.defaults()),
            anyList());
    }

    @Test
    void nothingIsArchivedWhenSchedulingFails() {
        when(schedulingService.generate(any()))
            .thenThrow(new SchedulingException(SchedulingFailure.INFEASIBLE, "1 subjects over 11 days in 1 rooms"));

        assertThatThrownBy(() -> runner.run()).isInstanceOf(SchedulingException.class);
        verify(archiveService, never()).save(any(), any(), any(), any(), anyList());
    }
}
