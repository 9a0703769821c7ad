package com.example.exam_scheduler.enums;

import lombok.Getter;

@Getter
public enum Difficulty {
  EASY("Easy"),
  MEDIUM("Medium"),
  HARD("Hard");

  private final String label;

  Difficulty(final String label) {
      this.label = label;
  }

  public static Difficulty fromLabel(String label) {
      for (Difficulty difficulty : values()) {
          if (difficulty.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
              return difficulty;
          }
      }
      throw new IllegalArgumentException("Unknown difficulty: " + label);
  }
}
