package com.flamingo.ai.bookqa.domain.enums;

/** Kind of material a chunk contains, detected from indicator phrases. */
public enum ContentType {
  DEFINITION,
  EXAMPLE,
  THEOREM,
  FORMULA,
  CONCEPT,
  APPLICATION,
  SUMMARY,

  /** Plain content with no specific indicator. */
  CONTENT
}
