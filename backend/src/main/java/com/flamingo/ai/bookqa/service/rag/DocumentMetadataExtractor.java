package com.flamingo.ai.bookqa.service.rag;

import com.flamingo.ai.bookqa.domain.enums.ContentType;
import com.flamingo.ai.bookqa.service.rag.model.ChunkMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts structural metadata from document chunks.
 *
 * <p>Detects chapter and section headings, page references, heading levels, content types and
 * simple text statistics. Headings only appear in the chunk that contains them, so {@link
 * #propagate(List)} carries chapter and section values forward to the chunks that follow.
 *
 * <p>All pattern lists are ordered tables evaluated first-match-wins.
 */
@Service
@Slf4j
public class DocumentMetadataExtractor {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

  private static final List<Pattern> CHAPTER_PATTERNS =
      List.of(
          Pattern.compile("^chapter\\s+(\\d+)[:\\s]+(.+?)$", FLAGS),
          Pattern.compile("^chapter\\s+(\\d+)(?:\\s|$)", FLAGS),
          Pattern.compile("^ch\\.\\s*(\\d+)[:\\s]+(.+?)$", FLAGS),
          Pattern.compile("^(\\d+)\\.\\s+(.+?)(?:chapter)?$", FLAGS),
          Pattern.compile("^unit\\s+(\\d+)[:\\s]+(.+?)$", FLAGS),
          Pattern.compile("^lesson\\s+(\\d+)[:\\s]+(.+?)$", FLAGS));

  private static final List<Pattern> SECTION_PATTERNS =
      List.of(
          Pattern.compile("^section\\s+(\\d+(?:\\.\\d+)?)[:\\s]+(.+?)$", FLAGS),
          Pattern.compile("^(\\d+\\.\\d+)[:\\s]+(.+?)$", FLAGS),
          Pattern.compile("^(\\d+\\.\\d+\\.\\d+)[:\\s]+(.+?)$", FLAGS));

  private static final List<Pattern> PAGE_PATTERNS =
      List.of(
          Pattern.compile("page\\s+(\\d+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("p\\.\\s*(\\d+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\[(\\d+)\\]"));

  private static final List<ContentIndicator> CONTENT_INDICATORS =
      List.of(
          new ContentIndicator(
              ContentType.DEFINITION,
              List.of(
                  "is defined as",
                  "is called",
                  "refers to",
                  "is known as",
                  "definition:",
                  "def:",
                  "means that",
                  "is a term")),
          new ContentIndicator(
              ContentType.EXAMPLE,
              List.of(
                  "for example",
                  "for instance",
                  "e.g.",
                  "such as",
                  "example:",
                  "consider",
                  "suppose",
                  "let us")),
          new ContentIndicator(
              ContentType.THEOREM,
              List.of(
                  "theorem",
                  "lemma",
                  "corollary",
                  "proposition",
                  "proof:",
                  "we prove",
                  "to prove")),
          new ContentIndicator(
              ContentType.FORMULA,
              List.of("=", "≈", "≠", "≤", "≥", "∑", "∫", "∂", "formula:", "equation:", "where:")),
          new ContentIndicator(
              ContentType.CONCEPT,
              List.of(
                  "important",
                  "key concept",
                  "fundamental",
                  "essential",
                  "note that",
                  "remember",
                  "it is important")),
          new ContentIndicator(
              ContentType.APPLICATION,
              List.of(
                  "application",
                  "used to",
                  "applied in",
                  "practical",
                  "in practice",
                  "real world",
                  "use case")),
          new ContentIndicator(
              ContentType.SUMMARY,
              List.of(
                  "in summary",
                  "to summarize",
                  "in conclusion",
                  "overall",
                  "key points",
                  "main ideas",
                  "recap")));

  private static final List<String> CODE_MARKERS =
      List.of("```", "`", "def ", "class ", "function", "import ", "#include");

  private static final Pattern NUMERIC_OUTLINE = Pattern.compile("^(\\d+(?:\\.\\d+)*)\\s");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
  private static final Pattern LIST_ITEM = Pattern.compile("^\\s*[-•*]\\s", Pattern.MULTILINE);
  private static final int HEADING_SCAN_LINES = 5;
  private static final int MAX_HEADING_LEVEL = 6;

  /**
   * Extracts metadata for one chunk.
   *
   * @param chunkText the chunk text
   * @param chunkIndex zero-based position of the chunk
   * @param totalChunks number of chunks in the document
   * @param documentName the source document, used for logging only
   * @param contextBefore text of the preceding chunk, searched for a chapter heading when the chunk
   *     has none; may be null
   * @return the chunk metadata, before propagation
   */
  public ChunkMetadata extract(
      String chunkText,
      int chunkIndex,
      int totalChunks,
      String documentName,
      String contextBefore) {
    String text = chunkText == null ? "" : chunkText;

    Optional<Heading> chapter = findChapter(text);
    if (chapter.isEmpty() && contextBefore != null && !contextBefore.isEmpty()) {
      chapter = findChapter(contextBefore);
    }
    Optional<Heading> section = findHeading(SECTION_PATTERNS, text, false);

    List<ContentType> contentTypes = detectContentTypes(text);
    Integer headingLevel = detectMinHeadingLevel(text);

    ChunkMetadata metadata =
        ChunkMetadata.builder()
            .chapterNumber(chapter.map(h -> parseNumber(h.number())).orElse(null))
            .chapterTitle(chapter.map(Heading::title).orElse(null))
            .sectionNumber(section.map(Heading::number).orElse(null))
            .sectionTitle(section.map(Heading::title).orElse(null))
            .pageNumber(extractPageNumber(text))
            .contentTypes(contentTypes)
            .hasHeadings(headingLevel != null)
            .minHeadingLevel(headingLevel)
            .charCount(text.length())
            .wordCount(countWords(text))
            .sentenceCount(countMatches(SENTENCE_END, text))
            .hasLists(LIST_ITEM.matcher(text).find())
            .hasCode(CODE_MARKERS.stream().anyMatch(text::contains))
            .hasQuestions(text.contains("?"))
            .chunkPosition((chunkIndex + 1) + "/" + totalChunks)
            .isFirst(chunkIndex == 0)
            .isLast(chunkIndex == totalChunks - 1)
            .build();

    if (log.isDebugEnabled() && (metadata.hasChapter() || metadata.hasSection())) {
      log.debug(
          "Chunk {} of '{}': chapter={}, section={}, types={}",
          chunkIndex,
          documentName,
          metadata.chapterNumber(),
          metadata.sectionNumber(),
          metadata.contentTypes());
    }
    return metadata;
  }

  /**
   * Carries chapter and section values forward in a single left-to-right pass.
   *
   * <p>A chunk that declares its own chapter (or section) becomes the current one; chunks without
   * one inherit the current value together with its title.
   *
   * @param metadataList metadata in document order
   * @return a new list with inherited chapter and section values filled in
   */
  public List<ChunkMetadata> propagate(List<ChunkMetadata> metadataList) {
    List<ChunkMetadata> result = new ArrayList<>(metadataList.size());
    Integer currentChapter = null;
    String currentChapterTitle = null;
    String currentSection = null;
    String currentSectionTitle = null;

    for (ChunkMetadata metadata : metadataList) {
      ChunkMetadata.ChunkMetadataBuilder builder = metadata.toBuilder();
      if (metadata.hasChapter()) {
        currentChapter = metadata.chapterNumber();
        currentChapterTitle = metadata.chapterTitle();
      } else if (currentChapter != null) {
        builder.chapterNumber(currentChapter).chapterTitle(currentChapterTitle);
      }

      if (metadata.hasSection()) {
        currentSection = metadata.sectionNumber();
        currentSectionTitle = metadata.sectionTitle();
      } else if (currentSection != null) {
        builder.sectionNumber(currentSection).sectionTitle(currentSectionTitle);
      }
      result.add(builder.build());
    }
    return result;
  }

  /**
   * Detects content types in table order.
   *
   * @param text the chunk text
   * @return detected types, or a single {@link ContentType#CONTENT} when none matched
   */
  public List<ContentType> detectContentTypes(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    List<ContentType> types = new ArrayList<>();
    for (ContentIndicator indicator : CONTENT_INDICATORS) {
      if (indicator.phrases().stream().anyMatch(lower::contains)) {
        types.add(indicator.type());
      }
    }
    return types.isEmpty() ? List.of(ContentType.CONTENT) : types;
  }

  /**
   * Returns the smallest heading level among the first lines of the chunk.
   *
   * @param text the chunk text
   * @return the heading level (1..6), or null when no line looks like a heading
   */
  Integer detectMinHeadingLevel(String text) {
    String[] lines = text.split("\n", HEADING_SCAN_LINES + 1);
    Integer minLevel = null;
    for (int i = 0; i < Math.min(lines.length, HEADING_SCAN_LINES); i++) {
      String line = lines[i].strip();
      Integer level = headingLevel(line);
      if (level != null && (minLevel == null || level < minLevel)) {
        minLevel = level;
      }
    }
    return minLevel;
  }

  private Integer headingLevel(String line) {
    if (line.startsWith("#")) {
      int hashes = 0;
      while (hashes < line.length() && line.charAt(hashes) == '#') {
        hashes++;
      }
      return Math.min(hashes, MAX_HEADING_LEVEL);
    }
    Matcher outline = NUMERIC_OUTLINE.matcher(line);
    if (outline.find()) {
      int dots = (int) outline.group(1).chars().filter(c -> c == '.').count();
      return Math.min(dots + 1, MAX_HEADING_LEVEL);
    }
    if (line.length() > 5 && line.length() < 100 && isUpperCase(line)) {
      return 2;
    }
    return null;
  }

  private boolean isUpperCase(String line) {
    return line.chars().anyMatch(Character::isLetter)
        && line.equals(line.toUpperCase(Locale.ROOT));
  }

  /** A chapter heading whose number does not fit an int is ignored along with its title. */
  private Optional<Heading> findChapter(String text) {
    return findHeading(CHAPTER_PATTERNS, text, true).filter(h -> parseNumber(h.number()) != null);
  }

  private Optional<Heading> findHeading(List<Pattern> patterns, String text, boolean chapter) {
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find()) {
        String number = matcher.group(1);
        String title =
            matcher.groupCount() >= 2 && matcher.group(2) != null
                ? matcher.group(2).strip()
                : null;
        if (chapter && (title == null || title.isEmpty())) {
          title = "Chapter " + number;
        }
        return Optional.of(new Heading(number, title));
      }
    }
    return Optional.empty();
  }

  private Integer extractPageNumber(String text) {
    for (Pattern pattern : PAGE_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find()) {
        return parseNumber(matcher.group(1));
      }
    }
    return null;
  }

  private Integer parseNumber(String digits) {
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      log.debug("Ignoring out-of-range number '{}'", digits);
      return null;
    }
  }

  private int countWords(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
  }

  private int countMatches(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private record Heading(String number, String title) {}

  private record ContentIndicator(ContentType type, List<String> phrases) {}
}
