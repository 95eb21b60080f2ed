package com.flamingo.ai.bookqa.domain.enums;

/** Difficulty suggested by the information density of retrieved content. */
public enum ContentDifficulty {
  BASIC,
  MEDIUM,
  ADVANCED
}
