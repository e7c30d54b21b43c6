package io.github.panghy.valkeyvector.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Converts text into fixed-length vectors. The adapter calls it once per batch on the insertion
 * path and once per query (or per batch of queries) on the search path.
 */
public interface EmbeddingEngine {

  /**
   * Embeds each text.
   *
   * @param texts texts to embed
   * @return a future with one vector per input text, in input order; every vector has
   *         {@link #getVectorSize()} elements
   */
  CompletableFuture<List<float[]>> embedText(List<String> texts);

  /** Returns the dimensionality of the vectors produced by {@link #embedText(List)}. */
  int getVectorSize();
}
