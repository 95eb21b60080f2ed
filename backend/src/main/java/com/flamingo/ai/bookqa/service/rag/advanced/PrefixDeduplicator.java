package com.flamingo.ai.bookqa.service.rag.advanced;

import com.flamingo.ai.bookqa.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Removes chunks whose leading text was already seen, keeping the first occurrence. */
final class PrefixDeduplicator {

  private PrefixDeduplicator() {}

  static List<RetrievedChunk> deduplicate(List<RetrievedChunk> chunks, int prefixChars) {
    Set<String> seen = new HashSet<>();
    List<RetrievedChunk> unique = new ArrayList<>();
    for (RetrievedChunk chunk : chunks) {
      if (seen.add(chunk.textPrefix(prefixChars))) {
        unique.add(chunk);
      }
    }
    return unique;
  }
}
