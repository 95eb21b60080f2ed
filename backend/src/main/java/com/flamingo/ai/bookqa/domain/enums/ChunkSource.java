package com.flamingo.ai.bookqa.domain.enums;

/** Retrieval path that produced a chunk when several paths are merged. */
public enum ChunkSource {
  HYDE("HyDE"),
  REGULAR("Regular"),
  ADVANCED_RAG("Advanced_RAG");

  private final String label;

  ChunkSource(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
