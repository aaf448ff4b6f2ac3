package com.flamingo.ai.tablerag.exception;

/** Exception thrown when a requested table image is not present in the artifact directory. */
public class TableImageNotFoundException extends RuntimeException {

  private final String fileName;

  public TableImageNotFoundException(String fileName) {
    super("Table image not found: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
