package com.flamingo.ai.tablerag.service.rag.detection;

import com.flamingo.ai.tablerag.service.rag.model.TableRegion;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Locates tables on a rendered page image.
 *
 * <p>Implementations wrap an external object-detection model. They may throw on any failure; the
 * caller treats that as a per-page error.
 */
public interface TableRegionDetector {

  /**
   * Detects table regions on one page.
   *
   * @param pageImage the rendered page
   * @param pageIndex 0-based index of the page, copied into every returned region
   * @param confidenceFloor minimum confidence a detection needs to be returned
   * @return detected regions in pixel coordinates of {@code pageImage}
   */
  List<TableRegion> detect(BufferedImage pageImage, int pageIndex, float confidenceFloor);
}
