package com.flamingo.ai.tablerag.service.rag.index;

import com.flamingo.ai.tablerag.config.EmbeddingProfile;
import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.NodeModality;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embeds nodes and assembles them into a {@link VectorIndex}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexBuilder {

  private final EmbeddingService embeddingService;
  private final EmbeddingProfile embeddingProfile;

  /**
   * Builds an index over {@code nodes}, keeping their order.
   *
   * @throws IllegalArgumentException if {@code nodes} is empty or contains a duplicate id
   * @throws EmbeddingModelMismatchException if the model returns vectors of an unexpected length
   */
  @Timed(value = "index.build", description = "Time to embed and build the vector index")
  public VectorIndex build(List<IndexNode> nodes) {
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException("Cannot build an index without nodes");
    }
    Set<String> ids = new HashSet<>();
    for (IndexNode node : nodes) {
      if (!ids.add(node.id())) {
        throw new IllegalArgumentException("Duplicate node id: " + node.id());
      }
    }

    long tableNodes =
        nodes.stream().filter(node -> node.modality() == NodeModality.TABLE_IMAGE).count();
    log.info(
        "Embedding {} total nodes ({} text + {} tables)...",
        nodes.size(),
        nodes.size() - tableNodes,
        tableNodes);

    List<IndexEntry> entries = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      float[] vector = embeddingService.embedPassage(nodes.get(i).text());
      if (vector.length != embeddingProfile.dimensions()) {
        throw new EmbeddingModelMismatchException(
            String.format(
                "Model %s returned %d dimensions for node %s, configured %d",
                embeddingProfile.modelName(),
                vector.length,
                nodes.get(i).id(),
                embeddingProfile.dimensions()));
      }
      entries.add(new IndexEntry(nodes.get(i), vector));
      if ((i + 1) % 50 == 0) {
        log.info("Embedded {}/{} nodes", i + 1, nodes.size());
      }
    }

    IndexManifest manifest =
        new IndexManifest(
            IndexManifest.CURRENT_FORMAT_VERSION,
            embeddingProfile.modelName(),
            embeddingProfile.dimensions(),
            nodes.size(),
            (int) (nodes.size() - tableNodes),
            (int) tableNodes,
            Instant.now().toString());
    return new VectorIndex(manifest, entries);
  }
}
