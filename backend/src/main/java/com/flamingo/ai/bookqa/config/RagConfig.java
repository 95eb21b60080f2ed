package com.flamingo.ai.bookqa.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Reranking reranking = new Reranking();
  private MultiQuery multiQuery = new MultiQuery();
  private AdvancedRag advancedRag = new AdvancedRag();
  private Indexing indexing = new Indexing();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;

    /** Upper bound for paragraph-packed chunks. */
    private int maxParagraphChunkSize = 1500;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 5;

    private Chat chat = new Chat();
    private Evaluation evaluation = new Evaluation();
    private QaGeneration qaGeneration = new QaGeneration();
    private Notes notes = new Notes();

    @Getter
    @Setter
    public static class Chat {
      /** Candidates fetched per requested chunk before reranking. */
      private int candidateMultiplier = 3;

      private double chapterConfidence = 0.90;
    }

    @Getter
    @Setter
    public static class Evaluation {
      private double chapterConfidence = 0.80;
      private double sectionConfidence = 0.85;
      private double scoreThreshold = 0.75;
      private double fallbackScoreThreshold = 0.70;

      /** Sequential neighbours added on each side of a hit. */
      private int neighborWindow = 2;
    }

    @Getter
    @Setter
    public static class QaGeneration {
      private double chapterConfidence = 0.70;
      private double sectionConfidence = 0.80;
    }

    @Getter
    @Setter
    public static class Notes {
      private double chapterConfidence = 0.70;
      private double sectionConfidence = 0.80;

      /** Cap for filter-only lookups that fetch a whole chapter or section. */
      private int maxChunks = 500;
    }
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;
    private double similarityWeight = 0.5;

    /** Density value treated as the maximum when blending with similarity. */
    private double densityNormalizer = 5.0;

    /** Number of most recently accepted chunks compared against each candidate. */
    private int diversityWindow = 3;

    private double overlapThreshold = 0.7;
    private int overlapPrefixChars = 200;
  }

  @Getter
  @Setter
  public static class MultiQuery {
    private int queriesToGenerate = 5;
    private int chunksPerQuery = 5;
    private int dedupPrefixChars = 100;

    /** Upper bound on waiting for one fan-out branch. */
    private long branchTimeoutMs = 15000;
  }

  @Getter
  @Setter
  public static class AdvancedRag {
    private int maxSubtopics = 3;
    private int variantsPerSubtopic = 3;
    private int chunksPerVariant = 5;
    private int minQuestionChunks = 20;
    private int maxCombinedChunks = 30;

    /** HyDE chunks merged into the question-generation context. */
    private int hydeChunks = 15;

    /** Chunks of the basic search used when multi-query finds nothing. */
    private int fallbackChunks = 15;

    private int consistencySamples = 3;
    private int consistencyChunksPerSample = 5;
  }

  @Getter
  @Setter
  public static class Indexing {
    private int embeddingBatchSize = 64;
  }
}
