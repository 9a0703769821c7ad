package com.example.exam_scheduler.repositories;

import java.util.List;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.exam_scheduler.entities.SubjectRecord;

@Repository
public class SubjectRepository {
    private final EntityManager entityManager;

    public SubjectRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public List<SubjectRecord> fetchAll() {
        return entityManager
            .createQuery("SELECT s FROM SubjectRecord s ORDER BY s.code, s.id", SubjectRecord.class)
            .getResultList();
    }

    public List<SubjectRecord> fetchBySemester(String semester) {
        if (semester == null || semester.isBlank()) {
            return fetchAll();
        }
        return entityManager
            .createQuery("SELECT s FROM SubjectRecord s WHERE s.semester = :semester ORDER BY s.code, s.id",
                SubjectRecord.class)
            .setParameter("semester", semester.trim())
            .getResultList();
    }
}
