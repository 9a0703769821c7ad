package com.example.exam_scheduler.repositories;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.exam_scheduler.entities.RoomRecord;

@Repository
public class RoomRepository {
    private final EntityManager entityManager;

    public RoomRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public List<RoomRecord> fetchAll() {
        return entityManager
            .createQuery("SELECT r FROM RoomRecord r ORDER BY r.type, r.name", RoomRecord.class)
            .getResultList();
    }

    public List<RoomRecord> fetchByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }
        return entityManager
            .createQuery("SELECT r FROM RoomRecord r WHERE r.id IN :ids ORDER BY r.type, r.name", RoomRecord.class)
            .setParameter("ids", ids)
            .getResultList();
    }
}
