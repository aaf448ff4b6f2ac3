package com.flamingo.ai.tablerag.service.rag.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An atomic indexable unit: either a chunk of page text or the summary of a table image.
 *
 * <p>Node ids are unique within an index and node text is never blank; both are enforced when a
 * node is constructed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "modality")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TextNode.class, name = "text"),
  @JsonSubTypes.Type(value = TableNode.class, name = "table_image")
})
public sealed interface IndexNode permits TextNode, TableNode {

  String id();

  /** Text that is embedded and shown to the language model. */
  String text();

  /** 1-based page number, or {@code null} if the page could not be resolved. */
  Integer pageNumber();

  NodeModality modality();

  static void requireContent(String id, String text) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node id must not be blank");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Node text must not be blank: " + id);
    }
  }
}
