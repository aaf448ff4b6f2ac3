package com.flamingo.ai.tablerag.exception;

/**
 * Exception thrown when vectors from one embedding space meet an index or query built in another.
 * Always fatal: comparing vectors across models yields meaningless scores.
 */
public class EmbeddingModelMismatchException extends RuntimeException {

  public EmbeddingModelMismatchException(String message) {
    super(message);
  }

  public String getUserMessage() {
    return "The index was built with a different embedding model. Re-run ingestion.";
  }
}
