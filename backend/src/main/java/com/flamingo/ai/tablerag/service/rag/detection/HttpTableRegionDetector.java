package com.flamingo.ai.tablerag.service.rag.detection;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.service.rag.model.TableRegion;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * {@link TableRegionDetector} backed by an HTTP table detection service (a YOLO table model served
 * behind {@code POST /detect}).
 *
 * <p>Request: {@code {"image": "<base64 png>", "confidence": 0.25}}. Response: a JSON array of
 * {@code {"x1", "y1", "x2", "y2", "confidence"}} boxes in pixel coordinates of the submitted image.
 */
@Component
@Slf4j
public class HttpTableRegionDetector implements TableRegionDetector {

  private final WebClient webClient;
  private final int readTimeoutMs;

  public HttpTableRegionDetector(RagConfig ragConfig) {
    RagConfig.Detection detection = ragConfig.getDetection();
    this.readTimeoutMs = detection.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(detection.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Table detector client initialized: baseUrl={}", detection.getBaseUrl());
  }

  @Override
  public List<TableRegion> detect(BufferedImage pageImage, int pageIndex, float confidenceFloor) {
    var request = new DetectRequest(encodePng(pageImage), confidenceFloor);
    List<DetectedBox> boxes =
        webClient
            .post()
            .uri("/detect")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToFlux(DetectedBox.class)
            .collectList()
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();

    if (boxes == null) {
      return List.of();
    }
    log.debug("Detector returned {} boxes for page {}", boxes.size(), pageIndex + 1);
    return boxes.stream()
        .filter(box -> box.confidence() >= confidenceFloor)
        .map(
            box ->
                new TableRegion(
                    pageIndex, box.x1(), box.y1(), box.x2(), box.y2(), box.confidence()))
        .toList();
  }

  private String encodePng(BufferedImage image) {
    try {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      ImageIO.write(image, "png", baos);
      return Base64.getEncoder().encodeToString(baos.toByteArray());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode page image", e);
    }
  }

  record DetectRequest(String image, float confidence) {}

  /** Detection service response element. */
  public record DetectedBox(float x1, float y1, float x2, float y2, float confidence) {}
}
