package com.flamingo.ai.tablerag.exception;

import java.nio.file.Path;

/** Exception thrown when the report to ingest does not exist. */
public class ReportNotFoundException extends RuntimeException {

  private final Path pdfPath;

  public ReportNotFoundException(Path pdfPath) {
    super("PDF not found at " + pdfPath);
    this.pdfPath = pdfPath;
  }

  public Path getPdfPath() {
    return pdfPath;
  }
}
