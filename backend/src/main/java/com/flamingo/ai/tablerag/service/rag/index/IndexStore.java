package com.flamingo.ai.tablerag.service.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tablerag.config.EmbeddingProfile;
import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.exception.IndexCorruptedException;
import com.flamingo.ai.tablerag.exception.IndexNotFoundException;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Reads and writes a {@link VectorIndex} as a directory of JSON files.
 *
 * <p>Layout:
 *
 * <ul>
 *   <li>{@code docstore.json}: node payloads in index order
 *   <li>{@code vector_store.json}: embeddings keyed by node id
 *   <li>{@code index_manifest.json}: {@link IndexManifest}
 * </ul>
 *
 * <p>Writes go to a sibling staging directory that is renamed over the target once complete, so a
 * reader sees either the previous index or the new one. A directory that is missing or empty means
 * nothing has been ingested; a directory with missing or inconsistent files is corrupted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexStore {

  static final String DOCSTORE_FILE = "docstore.json";
  static final String VECTOR_STORE_FILE = "vector_store.json";
  static final String MANIFEST_FILE = "index_manifest.json";

  private final ObjectMapper objectMapper;
  private final EmbeddingProfile embeddingProfile;

  /** Writes {@code index} to {@code directory}, replacing whatever was there. */
  public void persist(VectorIndex index, Path directory) throws IOException {
    Path target = directory.toAbsolutePath().normalize();
    Path parent = target.getParent();
    Files.createDirectories(parent);

    String suffix = UUID.randomUUID().toString().substring(0, 8);
    Path staging = parent.resolve(target.getFileName() + ".staging-" + suffix);
    Path backup = parent.resolve(target.getFileName() + ".old-" + suffix);
    boolean movedOld = false;

    try {
      Files.createDirectories(staging);
      writeFiles(index, staging);

      if (Files.exists(target)) {
        move(target, backup);
        movedOld = true;
      }
      move(staging, target);
    } catch (IOException e) {
      FileSystemUtils.deleteRecursively(staging);
      if (movedOld && !Files.exists(target)) {
        move(backup, target);
      }
      throw e;
    }

    if (movedOld) {
      FileSystemUtils.deleteRecursively(backup);
    }
    log.info("Index persisted to {} ({} nodes)", target, index.size());
  }

  /**
   * Loads the index in {@code directory}.
   *
   * @throws IndexNotFoundException if the directory is missing or empty
   * @throws IndexCorruptedException if any index file is missing, unreadable or inconsistent
   * @throws EmbeddingModelMismatchException if the index was built with another embedding model
   */
  public VectorIndex load(Path directory) {
    if (!exists(directory)) {
      throw new IndexNotFoundException(directory);
    }

    for (String file : List.of(MANIFEST_FILE, DOCSTORE_FILE, VECTOR_STORE_FILE)) {
      if (!Files.isReadable(directory.resolve(file))) {
        throw new IndexCorruptedException(directory, "Index file missing or unreadable: " + file);
      }
    }

    IndexManifest manifest = read(directory, MANIFEST_FILE, IndexManifest.class);
    checkProfile(manifest);

    DocStore docStore = read(directory, DOCSTORE_FILE, DocStore.class);
    VectorStore vectorStore = read(directory, VECTOR_STORE_FILE, VectorStore.class);

    if (docStore.nodes() == null
        || vectorStore.embeddings() == null
        || docStore.nodes().size() != manifest.nodeCount()) {
      throw new IndexCorruptedException(
          directory, "Node count does not match manifest in " + directory);
    }

    List<IndexEntry> entries = new ArrayList<>(docStore.nodes().size());
    for (IndexNode node : docStore.nodes()) {
      float[] embedding = vectorStore.embeddings().get(node.id());
      if (embedding == null) {
        throw new IndexCorruptedException(directory, "No embedding stored for node " + node.id());
      }
      entries.add(new IndexEntry(node, embedding));
    }

    VectorIndex index = new VectorIndex(manifest, entries);
    log.debug("Loaded index from {} ({} nodes)", directory, index.size());
    return index;
  }

  /** True if {@code directory} exists and contains at least one entry. */
  public boolean exists(Path directory) {
    if (!Files.isDirectory(directory)) {
      return false;
    }
    try (Stream<Path> children = Files.list(directory)) {
      return children.findAny().isPresent();
    } catch (IOException e) {
      log.warn("Cannot list index directory {}: {}", directory, e.getMessage());
      return false;
    }
  }

  private void writeFiles(VectorIndex index, Path dir) throws IOException {
    Map<String, float[]> embeddings = new LinkedHashMap<>();
    for (IndexEntry entry : index.entries()) {
      embeddings.put(entry.node().id(), entry.embedding());
    }
    objectMapper.writeValue(dir.resolve(DOCSTORE_FILE).toFile(), new DocStore(index.nodes()));
    objectMapper.writeValue(
        dir.resolve(VECTOR_STORE_FILE).toFile(),
        new VectorStore(index.manifest().dimensions(), embeddings));
    // manifest last: its presence marks a complete write
    objectMapper
        .writerWithDefaultPrettyPrinter()
        .writeValue(dir.resolve(MANIFEST_FILE).toFile(), index.manifest());
  }

  private <T> T read(Path directory, String file, Class<T> type) {
    try {
      return objectMapper.readValue(directory.resolve(file).toFile(), type);
    } catch (IOException e) {
      throw new IndexCorruptedException(
          directory, "Cannot read " + file + ": " + e.getMessage(), e);
    }
  }

  private void checkProfile(IndexManifest manifest) {
    if (!embeddingProfile.modelName().equals(manifest.embeddingModel())
        || embeddingProfile.dimensions() != manifest.dimensions()) {
      throw new EmbeddingModelMismatchException(
          String.format(
              "Index was built with %s (%d dims) but the configured model is %s (%d dims)",
              manifest.embeddingModel(),
              manifest.dimensions(),
              embeddingProfile.modelName(),
              embeddingProfile.dimensions()));
    }
  }

  private static void move(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(from, to);
    }
  }

  /** Contents of {@code docstore.json}. */
  public record DocStore(List<IndexNode> nodes) {}

  /** Contents of {@code vector_store.json}. */
  public record VectorStore(int dimensions, Map<String, float[]> embeddings) {}
}
