package com.flamingo.ai.tablerag.exception;

/** Exception thrown when an ingest run cannot produce a usable index. */
public class IngestionException extends RuntimeException {

  public IngestionException(String message) {
    super(message);
  }

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
