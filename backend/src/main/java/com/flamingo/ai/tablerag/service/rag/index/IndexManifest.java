package com.flamingo.ai.tablerag.service.rag.index;

/**
 * Self-description of a persisted index. Written last, so its presence marks a complete index.
 *
 * @param formatVersion layout version of the index files
 * @param embeddingModel embedding model the vectors came from
 * @param dimensions vector length
 * @param nodeCount total nodes
 * @param textNodeCount text chunk nodes
 * @param tableNodeCount table summary nodes
 * @param createdAt ISO-8601 build time
 */
public record IndexManifest(
    int formatVersion,
    String embeddingModel,
    int dimensions,
    int nodeCount,
    int textNodeCount,
    int tableNodeCount,
    String createdAt) {

  public static final int CURRENT_FORMAT_VERSION = 1;
}
