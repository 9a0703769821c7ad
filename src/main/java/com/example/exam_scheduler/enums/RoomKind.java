package com.example.exam_scheduler.enums;

import lombok.Getter;

@Getter
public enum RoomKind {
  CLASSROOM("Classroom"),
  LAB("Lab"),
  OTHER("Other");

  private final String label;

  RoomKind(final String label) {
      this.label = label;
  }

  // rooms stored with any other type label are untyped
  public static RoomKind fromLabel(String label) {
      if (label != null) {
          for (RoomKind kind : values()) {
              if (kind.label.equalsIgnoreCase(label.trim())) {
                  return kind;
              }
          }
      }
      return OTHER;
  }
}
