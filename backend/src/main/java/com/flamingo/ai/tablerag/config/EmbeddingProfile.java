package com.flamingo.ai.tablerag.config;

/**
 * Identity of the embedding space an index is built in.
 *
 * <p>An index may only be queried with the profile it was built with.
 *
 * @param modelName provider model name, e.g. {@code openai/text-embedding-3-small}
 * @param dimensions vector length produced by the model
 */
public record EmbeddingProfile(String modelName, int dimensions) {}
