package com.flamingo.ai.bookqa.domain.enums;

/** Outcome of a retrieval or indexing call. */
public enum RetrievalStatus {
  /** Results were produced as requested. */
  SUCCESS,

  /** Results were produced after relaxing filters or falling back to a simpler search. */
  FALLBACK,

  /** Nothing usable could be produced; the message explains why. */
  ERROR,

  /** The same content was already indexed under another document name. */
  DUPLICATE,

  /** The document was already indexed for this user. */
  ALREADY_INDEXED
}
