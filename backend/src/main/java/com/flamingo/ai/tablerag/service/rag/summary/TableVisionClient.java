package com.flamingo.ai.tablerag.service.rag.summary;

/**
 * Vision-language capability that turns a table image into searchable text.
 *
 * <p>Implementations must be safe for concurrent use: the summarization pool calls them from
 * several threads at once.
 */
public interface TableVisionClient {

  /**
   * Describes one table image.
   *
   * @param pngBytes PNG-encoded table crop
   * @param instruction what the model should produce
   * @return the model's reply, possibly blank
   */
  String describe(byte[] pngBytes, String instruction);
}
