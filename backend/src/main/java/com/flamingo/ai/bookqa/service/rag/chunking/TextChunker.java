package com.flamingo.ai.bookqa.service.rag.chunking;

import com.flamingo.ai.bookqa.config.RagConfig;
import com.flamingo.ai.bookqa.service.rag.DocumentMetadataExtractor;
import com.flamingo.ai.bookqa.service.rag.model.AnnotatedChunk;
import com.flamingo.ai.bookqa.service.rag.model.Chunk;
import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits plain document text into overlapping, character-bounded chunks.
 *
 * <p>Each window of {@code chunkSize} characters is shortened to end at the last paragraph break
 * inside it, else at the last sentence terminator, else it is cut hard. The next window starts
 * {@code overlap} characters before the previous end but always strictly after the previous start,
 * so the loop terminates for any {@code overlap < chunkSize}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TextChunker {

  private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n\\s*\\n");
  private static final char[] SENTENCE_BREAKS = {'.', '!', '?', '\n'};

  private final DocumentMetadataExtractor metadataExtractor;
  private final RagConfig ragConfig;

  /** Chunks text with the configured size and overlap. */
  public List<String> chunk(String text) {
    return chunk(text, ragConfig.getChunking().getSize(), ragConfig.getChunking().getOverlap());
  }

  /**
   * Chunks text with a sliding window that prefers paragraph and sentence boundaries.
   *
   * @param text the text to split
   * @param chunkSize maximum characters per chunk
   * @param chunkOverlap characters shared between consecutive windows
   * @return the chunks in document order; empty for blank input. Text no longer than {@code
   *     chunkSize} comes back unchanged as the only chunk, while longer text is stripped and each
   *     window trimmed.
   */
  public List<String> chunk(String text, int chunkSize, int chunkOverlap) {
    if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Invalid chunking parameters: size=" + chunkSize + ", overlap=" + chunkOverlap);
    }
    if (text == null || text.isBlank()) {
      log.warn("Empty text provided for chunking");
      return List.of();
    }

    if (text.length() <= chunkSize) {
      return List.of(text);
    }
    String cleaned = text.strip();

    List<String> chunks = new ArrayList<>();
    int length = cleaned.length();
    int start = 0;

    while (start < length) {
      int end = Math.min(start + chunkSize, length);
      if (end < length) {
        end = findBreak(cleaned, start, end);
      }

      String piece = cleaned.substring(start, end).strip();
      if (!piece.isEmpty()) {
        chunks.add(piece);
      }
      if (end >= length) {
        break;
      }

      int next = Math.max(end - chunkOverlap, 0);
      start = next > start ? Math.min(next, end) : end;
    }

    log.info(
        "Split text into {} chunks (length={}, avg chunk size={})",
        chunks.size(),
        length,
        length / chunks.size());
    return chunks;
  }

  /**
   * Packs whole paragraphs into chunks of at most {@code maxChunkSize} characters. A single
   * paragraph longer than the limit becomes its own chunk.
   *
   * @param text the text to split
   * @param maxChunkSize maximum characters per chunk
   * @return paragraph-aligned chunks
   */
  public List<String> chunkByParagraphs(String text, int maxChunkSize) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String paragraph : PARAGRAPH_SPLIT.split(text.strip())) {
      String para = paragraph.strip();
      if (para.isEmpty()) {
        continue;
      }
      if (current.length() > 0 && current.length() + para.length() + 2 > maxChunkSize) {
        chunks.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append("\n\n");
      }
      current.append(para);
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }

    log.info("Split text into {} paragraph-based chunks", chunks.size());
    return chunks;
  }

  /** Packs paragraphs using the configured paragraph chunk size. */
  public List<String> chunkByParagraphs(String text) {
    return chunkByParagraphs(text, ragConfig.getChunking().getMaxParagraphChunkSize());
  }

  /**
   * Chunks a document and attaches propagated structural metadata to every chunk.
   *
   * <p>The previous chunk is passed to the extractor as context so that a chapter heading at the
   * end of one chunk is credited to the next.
   *
   * @param text the document text
   * @param documentName the document name stored on each chunk
   * @return annotated chunks in document order
   */
  public List<AnnotatedChunk> chunkWithMetadata(String text, String documentName) {
    List<String> pieces = chunk(text);
    int total = pieces.size();

    List<ChunkMetadata> extracted = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      String contextBefore = i > 0 ? pieces.get(i - 1) : null;
      extracted.add(
          metadataExtractor.extract(pieces.get(i), i, total, documentName, contextBefore));
    }
    List<ChunkMetadata> propagated = metadataExtractor.propagate(extracted);

    List<AnnotatedChunk> result = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      result.add(new AnnotatedChunk(new Chunk(pieces.get(i), i, documentName), propagated.get(i)));
    }

    long withChapter = propagated.stream().filter(ChunkMetadata::hasChapter).count();
    long withSection = propagated.stream().filter(ChunkMetadata::hasSection).count();
    log.info(
        "Created {} chunks for '{}': {} with chapter info, {} with section info",
        total,
        documentName,
        withChapter,
        withSection);
    return result;
  }

  private int findBreak(String text, int start, int end) {
    int paragraphBreak = text.lastIndexOf("\n\n", end - 2);
    if (paragraphBreak > start) {
      return paragraphBreak + 2;
    }

    int best = -1;
    for (char breakChar : SENTENCE_BREAKS) {
      int pos = text.lastIndexOf(breakChar, end - 1);
      if (pos > start && pos > best) {
        best = pos;
      }
    }
    return best != -1 ? best + 1 : end;
  }
}
