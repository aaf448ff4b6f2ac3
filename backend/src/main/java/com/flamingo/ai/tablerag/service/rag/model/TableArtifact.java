package com.flamingo.ai.tablerag.service.rag.model;

import java.nio.file.Path;

/**
 * A cropped table image persisted by the extractor.
 *
 * @param imagePath absolute path of the PNG file
 * @param pageNumber 1-based page the table was cropped from
 * @param sequence position of this crop among all crops of the run (0-based)
 */
public record TableArtifact(Path imagePath, int pageNumber, int sequence) {

  public String fileName() {
    return imagePath.getFileName().toString();
  }

  /** File name for the {@code sequence}-th crop of a run, taken from 1-based page {@code page}. */
  public static String fileNameFor(int pageNumber, int sequence) {
    return "p" + pageNumber + "_table_" + sequence + ".png";
  }
}
