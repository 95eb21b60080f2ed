package com.flamingo.ai.bookqa.service.rag.advanced;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Splits a topic into focused subtopic queries using fixed templates. */
@Component
@Slf4j
public class QueryDecomposer {

  private static final List<String> BASE_TEMPLATES =
      List.of(
          "definition and meaning of %s",
          "examples and applications of %s",
          "key concepts in %s",
          "important aspects of %s");

  private static final List<Specialization> SPECIALIZATIONS =
      List.of(
          new Specialization(
              List.of("process", "method", "approach"), "steps and procedures in %s"),
          new Specialization(
              List.of("theory", "principle", "law"), "principles and theories of %s"),
          new Specialization(
              List.of("history", "evolution", "development"), "historical development of %s"));

  /**
   * Decomposes a topic into subtopics, the topic itself first.
   *
   * @param topic the topic or query
   * @return the topic followed by its generic and topic-specific subtopics
   */
  public List<String> decompose(String topic) {
    List<String> subtopics = new ArrayList<>();
    subtopics.add(topic);
    BASE_TEMPLATES.forEach(template -> subtopics.add(String.format(template, topic)));

    String lower = topic.toLowerCase(Locale.ROOT);
    for (Specialization specialization : SPECIALIZATIONS) {
      if (specialization.triggers().stream().anyMatch(lower::contains)) {
        subtopics.add(String.format(specialization.template(), topic));
      }
    }
    log.debug("Decomposed '{}' into {} subtopics", topic, subtopics.size());
    return subtopics;
  }

  private record Specialization(List<String> triggers, String template) {}
}
