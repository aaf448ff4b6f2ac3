package com.flamingo.ai.tablerag.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and query pipelines. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Detection detection = new Detection();
  private Summarization summarization = new Summarization();
  private Retrieval retrieval = new Retrieval();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Chunking {
    /** Window size in characters. */
    private int size = 1024;

    /** Characters shared by consecutive windows; must stay below {@link #size}. */
    private int overlap = 200;
  }

  /** Configuration for table region detection on rendered pages. */
  @Getter
  @Setter
  public static class Detection {
    /** Base URL of the table detection service. */
    private String baseUrl = "http://localhost:8091";

    /** Boxes scoring below this value are discarded. */
    private float confidenceFloor = 0.25f;

    /** Page upscale factor applied before detection (1.0 = 72 DPI). */
    private float renderScale = 2.0f;

    private int readTimeoutMs = 30000;
  }

  /** Configuration for vision-language summarization of table crops. */
  @Getter
  @Setter
  public static class Summarization {
    /** Maximum number of in-flight vision requests. */
    private int concurrency = 5;

    /** Per-request timeout for a single vision call. */
    private int timeoutSeconds = 60;

    private int maxCompletionTokens = 1024;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 15;
  }

  /** Locations of the input report and of everything an ingest run writes. */
  @Getter
  @Setter
  public static class Storage {
    private String pdfPath = "data/report.pdf";
    private String tableOutputDir = "data/processed_tables";
    private String indexDir = "./storage";
  }
}
