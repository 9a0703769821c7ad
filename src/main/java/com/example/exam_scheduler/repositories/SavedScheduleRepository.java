package com.example.exam_scheduler.repositories;

import java.util.Optional;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.exam_scheduler.entities.SavedSchedule;

@Repository
public class SavedScheduleRepository {
    private final EntityManager entityManager;

    public SavedScheduleRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public Optional<SavedSchedule> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityManager.find(SavedSchedule.class, id));
    }

    public Optional<SavedSchedule> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return entityManager
            .createQuery("SELECT s FROM SavedSchedule s WHERE s.name = :name", SavedSchedule.class)
            .setParameter("name", name)
            .getResultStream()
            .findFirst();
    }

    public SavedSchedule save(SavedSchedule schedule) {
        if (schedule.getId() == null) {
            entityManager.persist(schedule);
            return schedule;
        }
        return entityManager.merge(schedule);
    }

    public void delete(SavedSchedule schedule) {
        entityManager.remove(entityManager.contains(schedule) ? schedule : entityManager.merge(schedule));
    }
}
