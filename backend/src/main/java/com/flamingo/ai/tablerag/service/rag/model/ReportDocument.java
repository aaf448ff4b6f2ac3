package com.flamingo.ai.tablerag.service.rag.model;

import java.nio.file.Path;

/**
 * The source PDF of an ingest run.
 *
 * @param path location of the PDF on disk
 * @param pageCount number of pages in the PDF
 */
public record ReportDocument(Path path, int pageCount) {}
