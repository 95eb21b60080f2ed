package com.flamingo.ai.bookqa.service.rag.strategy;

import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved chunks into the context text handed to the downstream model.
 *
 * <p>Each style labels chunks differently; chunks are always separated by a blank line.
 */
@Component
public class ContextBuilder {

  private static final String CHUNK_SEPARATOR = "\n\n";
  private static final String BANNER = "=".repeat(60);
  private static final String NOT_AVAILABLE = "N/A";

  /** Numbered chunks with their relevance, e.g. {@code [Chunk 1, Relevance: 0.87]}. */
  public String conversational(List<RetrievedChunk> chunks) {
    List<String> parts = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      RetrievedChunk chunk = chunks.get(i);
      parts.add(
          String.format(
                  Locale.ROOT, "[Chunk %d, Relevance: %.2f]", i + 1, scoreOrZero(chunk.getScore()))
              + "\n"
              + text(chunk));
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  /**
   * Numbered chunks with chapter, section and score; missing values render as {@code N/A}.
   */
  public String detailed(List<RetrievedChunk> chunks) {
    List<String> parts = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      RetrievedChunk chunk = chunks.get(i);
      ChunkMetadata metadata = chunk.getMetadata();
      Object chapter = metadata.chapterNumber() != null ? metadata.chapterNumber() : NOT_AVAILABLE;
      Object section = metadata.sectionNumber() != null ? metadata.sectionNumber() : NOT_AVAILABLE;
      parts.add(
          String.format(
                  Locale.ROOT,
                  "[Chunk %d | Chapter %s | Section %s | Score: %.2f]",
                  i + 1,
                  chapter,
                  section,
                  scoreOrZero(chunk.getScore()))
              + "\n"
              + text(chunk));
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  /** Chunks labelled with their sequential id, e.g. {@code [Chunk 42]}. */
  public String structured(List<RetrievedChunk> chunks) {
    List<String> parts = new ArrayList<>(chunks.size());
    for (RetrievedChunk chunk : chunks) {
      parts.add("[Chunk " + chunk.getSequentialId() + "]\n" + text(chunk));
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  /**
   * One banner per section followed by the section's chunk texts.
   *
   * @param sections chunks grouped by section name, in presentation order
   * @return the rendered context
   */
  public String hierarchical(Map<String, List<RetrievedChunk>> sections) {
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, List<RetrievedChunk>> section : sections.entrySet()) {
      parts.add("\n" + BANNER + "\n" + section.getKey() + "\n" + BANNER);
      for (RetrievedChunk chunk : section.getValue()) {
        parts.add(text(chunk));
      }
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  /**
   * Numbered chunks with their reranked relevance and information density, used for question
   * generation.
   */
  public String withDensity(List<RetrievedChunk> chunks) {
    List<String> parts = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      RetrievedChunk chunk = chunks.get(i);
      parts.add(
          String.format(
                  Locale.ROOT,
                  "[Chunk %d, Relevance: %.2f, Info Density: %.1f]",
                  i + 1,
                  relevance(chunk),
                  scoreOrZero(chunk.getDensityScore()))
              + "\n"
              + text(chunk));
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  /**
   * Like {@link #withDensity(List)} but also names the retrieval path of each chunk, capped at
   * {@code limit} chunks.
   */
  public String withSource(List<RetrievedChunk> chunks, int limit) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < chunks.size() && i < limit; i++) {
      RetrievedChunk chunk = chunks.get(i);
      String source = chunk.getSource() != null ? chunk.getSource().getLabel() : "Unknown";
      parts.add(
          String.format(
                  Locale.ROOT,
                  "[Chunk %d | Relevance: %.2f | Density: %.1f | Source: %s]",
                  i + 1,
                  relevance(chunk),
                  scoreOrZero(chunk.getDensityScore()),
                  source)
              + "\n"
              + text(chunk));
    }
    return String.join(CHUNK_SEPARATOR, parts);
  }

  private static double relevance(RetrievedChunk chunk) {
    return chunk.getCompositeScore() != null
        ? chunk.getCompositeScore()
        : scoreOrZero(chunk.getScore());
  }

  private static double scoreOrZero(Double score) {
    return score == null ? 0.0 : score;
  }

  private static String text(RetrievedChunk chunk) {
    return chunk.getText() == null ? "" : chunk.getText();
  }
}
