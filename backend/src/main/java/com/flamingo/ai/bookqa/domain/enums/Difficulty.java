package com.flamingo.ai.bookqa.domain.enums;

/** Difficulty level requested in a query. */
public enum Difficulty {
  EASY,
  MEDIUM,
  HARD
}
