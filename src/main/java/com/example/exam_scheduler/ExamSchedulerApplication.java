package com.example.exam_scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExamSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamSchedulerApplication.class, args);
    }
}
