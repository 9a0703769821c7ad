package com.example.exam_scheduler.enums;

import lombok.Getter;

@Getter
public enum SubjectKind {
  THEORY("Theory"),
  PRACTICAL("Practical");

  private final String label;

  SubjectKind(final String label) {
      this.label = label;
  }

  /**
   * Whether an exam of this kind may sit in a room of the given kind.
   * Theory exams never go to a lab, practical exams never go to a classroom.
   * Untyped rooms accept both.
   */
  public boolean accepts(RoomKind roomKind) {
      if (this == THEORY) {
          return roomKind != RoomKind.LAB;
      }
      return roomKind != RoomKind.CLASSROOM;
  }

  public static SubjectKind fromLabel(String label) {
      for (SubjectKind kind : values()) {
          if (kind.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
              return kind;
          }
      }
      throw new IllegalArgumentException("Unknown subject type: " + label);
  }
}
