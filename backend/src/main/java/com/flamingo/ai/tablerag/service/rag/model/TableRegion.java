package com.flamingo.ai.tablerag.service.rag.model;

/**
 * A single table detection on a rendered page.
 *
 * <p>Coordinates are in pixel space of the rendered page image (origin top-left), not PDF units.
 *
 * @param pageIndex 0-based page index
 * @param x1 left edge
 * @param y1 top edge
 * @param x2 right edge
 * @param y2 bottom edge
 * @param confidence detector confidence in {@code [0, 1]}
 */
public record TableRegion(
    int pageIndex, float x1, float y1, float x2, float y2, float confidence) {}
