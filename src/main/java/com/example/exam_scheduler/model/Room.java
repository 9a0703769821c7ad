package com.example.exam_scheduler.model;

import com.example.exam_scheduler.enums.RoomKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Room {
    Long id;
    String name;
    @NonNull
    RoomKind kind;
    int capacity;
}
