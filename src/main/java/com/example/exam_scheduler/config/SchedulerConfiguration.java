package com.example.exam_scheduler.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.example.exam_scheduler.engine.CalendarBuilder;
import com.example.exam_scheduler.engine.ConstraintCompiler;
import com.example.exam_scheduler.engine.ScheduleMaterializer;
import com.example.exam_scheduler.engine.ScheduleVerifier;
import com.example.exam_scheduler.solver.CpSatSolverBackend;
import com.example.exam_scheduler.solver.SolverBackend;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfiguration {

    @Bean
    public CalendarBuilder calendarBuilder() {
        return new CalendarBuilder();
    }

    @Bean
    public ConstraintCompiler constraintCompiler() {
        return new ConstraintCompiler();
    }

    @Bean
    public ScheduleMaterializer scheduleMaterializer() {
        return new ScheduleMaterializer();
    }

    @Bean
    public ScheduleVerifier scheduleVerifier() {
        return new ScheduleVerifier();
    }

    @Bean
    public SolverBackend solverBackend(SchedulerProperties properties) {
        SchedulerProperties.Solver solver = properties.getSolver();
        log.info("CP-SAT backend: {} search workers, search logging {}",
            solver.getNumWorkers(), solver.isLogSearchProgress() ? "on" : "off");
        return new CpSatSolverBackend(solver.getNumWorkers(), solver.isLogSearchProgress());
    }

    @Bean
    public ThreadPoolTaskExecutor schedulingExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getPoolSize());
        executor.setThreadNamePrefix("exam-scheduling-");
        executor.initialize();
        return executor;
    }
}
