package com.flamingo.ai.tablerag.service.rag.index;

import static com.flamingo.ai.tablerag.support.TestNodes.entry;
import static com.flamingo.ai.tablerag.support.TestNodes.index;
import static com.flamingo.ai.tablerag.support.TestNodes.table;
import static com.flamingo.ai.tablerag.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.model.ScoredNode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorIndex Tests")
class VectorIndexTest {

  private VectorIndex index;

  @BeforeEach
  void setUp() {
    index =
        index(
            List.of(
                entry(text("a", "revenue", 1), 1f, 0f),
                entry(text("b", "costs", 2), 0f, 1f),
                entry(table("p3_table_0.png", "revenue table", 3), 0.9f, 0.1f),
                entry(text("c", "mixed", 4), 0.5f, 0.5f)));
  }

  @Test
  @DisplayName("Should return at most k hits ordered by descending score")
  void shouldReturnTopKByScore() {
    RetrievalResult result = index.search(new float[] {1f, 0f}, 3);

    assertThat(result.size()).isEqualTo(3);
    assertThat(result.nodes())
        .extracting(IndexNode::id)
        .containsExactly("a", "table-p3_table_0.png", "c");
    assertThat(result.hits())
        .extracting(ScoredNode::score)
        .isSortedAccordingTo((x, y) -> Double.compare(y, x));
  }

  @Test
  @DisplayName("Should return every node when k exceeds the index size")
  void shouldCapAtIndexSize() {
    assertThat(index.search(new float[] {1f, 1f}, 50).size()).isEqualTo(4);
  }

  @Test
  @DisplayName("Should keep insertion order for equal scores")
  void shouldBreakTiesByInsertionOrder() {
    VectorIndex tied =
        index(
            List.of(
                entry(text("first", "x", 1), 1f, 0f),
                entry(text("second", "y", 2), 2f, 0f),
                entry(text("third", "z", 3), 3f, 0f)));

    RetrievalResult result = tied.search(new float[] {1f, 0f}, 3);

    assertThat(result.nodes())
        .extracting(IndexNode::id)
        .containsExactly("first", "second", "third");
    assertThat(tied.search(new float[] {1f, 0f}, 3)).isEqualTo(result);
  }

  @Test
  @DisplayName("Should reject non-positive k")
  void shouldRejectNonPositiveK() {
    assertThatThrownBy(() -> index.search(new float[] {1f, 0f}, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should reject a query vector of the wrong dimension")
  void shouldRejectWrongQueryDimension() {
    assertThatThrownBy(() -> index.search(new float[] {1f, 0f, 0f}, 3))
        .isInstanceOf(EmbeddingModelMismatchException.class);
  }

  @Test
  @DisplayName("Should reject duplicate node ids")
  void shouldRejectDuplicateIds() {
    List<IndexEntry> entries =
        List.of(entry(text("a", "x", 1), 1f, 0f), entry(text("a", "y", 2), 0f, 1f));

    assertThatThrownBy(() -> index(entries))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  @DisplayName("Should score zero vectors as zero similarity")
  void shouldScoreZeroVectorsAsZero() {
    assertThat(VectorIndex.cosine(new float[] {0f, 0f}, new float[] {1f, 0f})).isZero();
    assertThat(VectorIndex.cosine(new float[] {1f, 1f}, new float[] {2f, 2f}))
        .isCloseTo(1.0, within(1e-9));
  }
}
