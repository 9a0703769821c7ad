package com.example.exam_scheduler.entities;

import com.example.exam_scheduler.enums.RoomKind;
import com.example.exam_scheduler.model.Room;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "rooms")
@Getter
@Setter
public class RoomRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Column(name = "type", nullable = false, length = 20)
    private String type;

    @Column(name = "capacity", nullable = false)
    private int capacity;

    public Room toSnapshot() {
        return Room.builder()
            .id(id)
            .name(name)
            .kind(RoomKind.fromLabel(type))
            .capacity(capacity)
            .build();
    }
}
