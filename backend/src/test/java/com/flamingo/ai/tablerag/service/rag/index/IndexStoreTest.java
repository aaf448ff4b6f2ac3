package com.flamingo.ai.tablerag.service.rag.index;

import static com.flamingo.ai.tablerag.support.TestNodes.entry;
import static com.flamingo.ai.tablerag.support.TestNodes.index;
import static com.flamingo.ai.tablerag.support.TestNodes.table;
import static com.flamingo.ai.tablerag.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tablerag.config.EmbeddingProfile;
import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.exception.IndexCorruptedException;
import com.flamingo.ai.tablerag.exception.IndexNotFoundException;
import com.flamingo.ai.tablerag.service.rag.model.TableNode;
import com.flamingo.ai.tablerag.support.TestNodes;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("IndexStore Tests")
class IndexStoreTest {

  @TempDir Path tempDir;

  private ObjectMapper objectMapper;
  private IndexStore indexStore;
  private VectorIndex index;
  private Path indexDir;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    indexStore = new IndexStore(objectMapper, new EmbeddingProfile(TestNodes.MODEL, 2));
    index =
        index(
            List.of(
                entry(text("text-p1-0", "Revenue grew 8 percent", 1), 0.9f, 0.1f),
                entry(text("text-p2-0", "Headcount was flat", 2), 0.1f, 0.9f),
                entry(table("p2_table_0.png", "Revenue by region table", 2), 0.8f, 0.3f)));
    indexDir = tempDir.resolve("storage");
  }

  @Test
  @DisplayName("Should reload exactly what was persisted")
  void shouldRoundTrip() throws Exception {
    indexStore.persist(index, indexDir);

    VectorIndex loaded = indexStore.load(indexDir);

    assertThat(loaded.nodes()).containsExactlyElementsOf(index.nodes());
    assertThat(loaded.nodes().get(2)).isInstanceOf(TableNode.class);
    assertThat(loaded.manifest()).isEqualTo(index.manifest());
    for (int i = 0; i < index.size(); i++) {
      assertThat(loaded.entries().get(i).embedding())
          .containsExactly(index.entries().get(i).embedding());
    }
  }

  @Test
  @DisplayName("Should retrieve the same hits after a reload as in memory")
  void shouldRetrieveSameHitsAfterReload() throws Exception {
    float[] query = {1f, 0.2f};
    indexStore.persist(index, indexDir);

    assertThat(indexStore.load(indexDir).search(query, 2)).isEqualTo(index.search(query, 2));
  }

  @Test
  @DisplayName("Should write the three index files")
  void shouldWriteIndexFiles() throws Exception {
    indexStore.persist(index, indexDir);

    assertThat(indexDir.resolve(IndexStore.DOCSTORE_FILE)).isRegularFile();
    assertThat(indexDir.resolve(IndexStore.VECTOR_STORE_FILE)).isRegularFile();
    assertThat(indexDir.resolve(IndexStore.MANIFEST_FILE)).isRegularFile();
    assertThat(Files.readString(indexDir.resolve(IndexStore.DOCSTORE_FILE)))
        .contains("\"modality\":\"table_image\"")
        .contains("\"modality\":\"text\"");
  }

  @Test
  @DisplayName("Should replace a previous index and leave no staging directories behind")
  void shouldReplacePreviousIndex() throws Exception {
    indexStore.persist(index, indexDir);
    VectorIndex smaller = index(List.of(entry(text("only", "Only node", 1), 1f, 0f)));

    indexStore.persist(smaller, indexDir);

    assertThat(indexStore.load(indexDir).size()).isEqualTo(1);
    try (var siblings = Files.list(tempDir)) {
      assertThat(siblings).containsExactly(indexDir);
    }
  }

  @Test
  @DisplayName("Should report a missing directory as not ingested")
  void shouldReportMissingDirectory() {
    assertThat(indexStore.exists(indexDir)).isFalse();
    assertThatThrownBy(() -> indexStore.load(indexDir))
        .isInstanceOf(IndexNotFoundException.class);
  }

  @Test
  @DisplayName("Should report an empty directory as not ingested")
  void shouldReportEmptyDirectory() throws Exception {
    Files.createDirectories(indexDir);

    assertThatThrownBy(() -> indexStore.load(indexDir))
        .isInstanceOf(IndexNotFoundException.class);
  }

  @Test
  @DisplayName("Should report a directory with a missing file as corrupted")
  void shouldReportMissingFileAsCorrupted() throws Exception {
    indexStore.persist(index, indexDir);
    Files.delete(indexDir.resolve(IndexStore.VECTOR_STORE_FILE));

    assertThatThrownBy(() -> indexStore.load(indexDir))
        .isInstanceOf(IndexCorruptedException.class)
        .hasMessageContaining(IndexStore.VECTOR_STORE_FILE);
  }

  @Test
  @DisplayName("Should report unparseable files as corrupted")
  void shouldReportGarbageAsCorrupted() throws Exception {
    indexStore.persist(index, indexDir);
    Files.writeString(indexDir.resolve(IndexStore.DOCSTORE_FILE), "{not json");

    assertThatThrownBy(() -> indexStore.load(indexDir))
        .isInstanceOf(IndexCorruptedException.class);
  }

  @Test
  @DisplayName("Should refuse an index built with another embedding model")
  void shouldRefuseOtherEmbeddingModel() throws Exception {
    indexStore.persist(index, indexDir);
    IndexStore otherModel =
        new IndexStore(objectMapper, new EmbeddingProfile("text-embedding-3-large", 2));

    assertThatThrownBy(() -> otherModel.load(indexDir))
        .isInstanceOf(EmbeddingModelMismatchException.class)
        .hasMessageContaining("text-embedding-3-large");
  }
}
