package com.flamingo.ai.tablerag.service.rag.model;

/**
 * Modality an {@link IndexNode} was extracted from. The persisted type names live on {@link
 * IndexNode}'s subtype mapping.
 */
public enum NodeModality {
  TEXT,
  TABLE_IMAGE
}
