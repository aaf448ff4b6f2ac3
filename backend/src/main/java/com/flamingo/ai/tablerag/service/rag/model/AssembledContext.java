package com.flamingo.ai.tablerag.service.rag.model;

import java.util.List;

/**
 * Provenance-annotated context for the synthesizer.
 *
 * @param text retrieved nodes concatenated in retrieval order, each under a source header
 * @param sourceImages distinct image paths of table hits, in first-occurrence order
 */
public record AssembledContext(String text, List<String> sourceImages) {

  public AssembledContext {
    sourceImages = List.copyOf(sourceImages);
  }
}
