package com.flamingo.ai.tablerag.service.rag.model;

/**
 * The vision-language summary of one table image.
 *
 * @param id node id, {@code table-{fileName}}
 * @param text summary produced from the image
 * @param imagePath absolute path of the source PNG
 * @param fileName file name of the source PNG, used for citations
 * @param pageNumber 1-based page of the table, {@code null} if unresolved
 */
public record TableNode(
    String id, String text, String imagePath, String fileName, Integer pageNumber)
    implements IndexNode {

  public TableNode {
    IndexNode.requireContent(id, text);
    if (imagePath == null || imagePath.isBlank()) {
      throw new IllegalArgumentException("Table node requires an image path: " + id);
    }
  }

  @Override
  public NodeModality modality() {
    return NodeModality.TABLE_IMAGE;
  }
}
