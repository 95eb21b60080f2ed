package com.flamingo.ai.bookqa.domain.enums;

/** Preferred amount of text per retrieved unit for a use-case. */
public enum ChunkSizePreference {
  SMALL,
  MEDIUM,
  LARGE
}
