package com.flamingo.ai.tablerag.service.rag.index;

import com.flamingo.ai.tablerag.service.rag.model.IndexNode;

/** A node and its embedding. */
public record IndexEntry(IndexNode node, float[] embedding) {}
