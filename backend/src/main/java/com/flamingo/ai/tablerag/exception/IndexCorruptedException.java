package com.flamingo.ai.tablerag.exception;

import java.nio.file.Path;

/** Exception thrown when an index directory exists but does not hold a complete, loadable index. */
public class IndexCorruptedException extends RuntimeException {

  private final Path indexDir;

  public IndexCorruptedException(Path indexDir, String message) {
    super(message);
    this.indexDir = indexDir;
  }

  public IndexCorruptedException(Path indexDir, String message, Throwable cause) {
    super(message, cause);
    this.indexDir = indexDir;
  }

  public Path getIndexDir() {
    return indexDir;
  }

  public String getUserMessage() {
    return "The stored index is incomplete or damaged. Run the ingest command again.";
  }
}
