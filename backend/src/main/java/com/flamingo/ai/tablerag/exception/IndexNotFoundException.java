package com.flamingo.ai.tablerag.exception;

import java.nio.file.Path;

/** Exception thrown when the index directory is missing or empty, i.e. nothing was ingested. */
public class IndexNotFoundException extends RuntimeException {

  private final Path indexDir;

  public IndexNotFoundException(Path indexDir) {
    super("No index found at " + indexDir);
    this.indexDir = indexDir;
  }

  public Path getIndexDir() {
    return indexDir;
  }

  public String getUserMessage() {
    return "Database not found. Run the ingest command first.";
  }
}
