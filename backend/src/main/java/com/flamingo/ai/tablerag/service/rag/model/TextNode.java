package com.flamingo.ai.tablerag.service.rag.model;

/**
 * A window of page text.
 *
 * @param id node id, {@code text-p{page}-{index}}
 * @param text chunk content
 * @param pageNumber 1-based page the chunk was cut from
 */
public record TextNode(String id, String text, Integer pageNumber) implements IndexNode {

  public TextNode {
    IndexNode.requireContent(id, text);
    if (pageNumber == null || pageNumber < 1) {
      throw new IllegalArgumentException("Text node requires a 1-based page number: " + id);
    }
  }

  @Override
  public NodeModality modality() {
    return NodeModality.TEXT;
  }
}
