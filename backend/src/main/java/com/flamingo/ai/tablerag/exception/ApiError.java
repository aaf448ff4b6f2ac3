package com.flamingo.ai.tablerag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INDEX_CORRUPTED = "INDEX_002";
  public static final String EMBEDDING_MISMATCH = "INDEX_003";
  public static final String TABLE_NOT_FOUND = "TABLE_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
