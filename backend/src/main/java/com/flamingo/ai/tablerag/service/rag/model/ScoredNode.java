package com.flamingo.ai.tablerag.service.rag.model;

/** A node paired with its similarity to the query. */
public record ScoredNode(IndexNode node, double score) {}
