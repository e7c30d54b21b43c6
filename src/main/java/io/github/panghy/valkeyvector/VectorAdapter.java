package io.github.panghy.valkeyvector;

import io.github.panghy.valkeyvector.api.DataPoint;
import io.github.panghy.valkeyvector.api.DeleteResult;
import io.github.panghy.valkeyvector.api.ScoredResult;
import io.github.panghy.valkeyvector.search.SearchEngine;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import redis.clients.jedis.UnifiedJedis;

/**
 * Asynchronous vector store over named collections.
 *
 * <p>Callers hand in typed records ({@link DataPoint}); the adapter embeds their text, stores them
 * as documents with a vector field and finds them again by similarity. All operations return
 * {@link CompletableFuture} and may be issued concurrently.</p>
 *
 * <p>Existence checks are soft on read paths and hard on write paths:
 * <ul>
 *   <li>{@link #search} and {@link #batchSearch} on a missing collection return an empty list</li>
 *   <li>{@link #createDataPoints} on a missing collection fails with
 *       {@link CollectionNotFoundException}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * VectorAdapter adapter = new ValkeyVectorAdapter(config, embeddingEngine);
 * adapter.createCollection("docs").join();
 * adapter.createDataPoints("docs", List.of(TextChunk.of(id, "Hello Valkey"))).join();
 * List<ScoredResult> hits = adapter.search("docs", "Hello", 10).join();
 * }</pre>
 */
public interface VectorAdapter extends AutoCloseable {

  /** Returns true if the collection's index exists. Never fails; lookup errors read as false. */
  CompletableFuture<Boolean> hasCollection(String collectionName);

  /**
   * Creates the collection's index unless it already exists. Concurrent calls for the same name
   * create one index.
   */
  default CompletableFuture<Void> createCollection(String collectionName) {
    return createCollection(collectionName, null);
  }

  /**
   * Same as {@link #createCollection(String)}. The payload schema is accepted for compatibility
   * and currently not used; the index definition is always derived internally.
   */
  CompletableFuture<Void> createCollection(String collectionName, Map<String, Object> payloadSchema);

  /**
   * Embeds and stores data points. An empty list performs no writes.
   *
   * @return a future failing with {@link CollectionNotFoundException} if the collection is missing
   */
  CompletableFuture<Void> createDataPoints(String collectionName, List<? extends DataPoint> dataPoints);

  /** Fetches stored payloads by id. Best-effort: failures yield an empty list. */
  CompletableFuture<List<Map<String, Object>>> retrieve(String collectionName, List<String> dataPointIds);

  /**
   * Finds the nearest neighbors of a text or a vector.
   *
   * @param queryText   text to embed; ignored when {@code queryVector} is given
   * @param queryVector precomputed query vector
   * @param limit       maximum results; {@code null} means every document in the collection
   * @param withVector  whether to return stored vectors
   * @return a future failing with {@link MissingQueryParameterException} if both query inputs are
   *         null; an empty list if the collection does not exist
   */
  CompletableFuture<List<ScoredResult>> search(
      String collectionName, String queryText, float[] queryVector, Integer limit, boolean withVector);

  /** Text search returning at most {@link SearchEngine#DEFAULT_LIMIT} results, without vectors. */
  default CompletableFuture<List<ScoredResult>> search(String collectionName, String queryText) {
    return search(collectionName, queryText, null, SearchEngine.DEFAULT_LIMIT, false);
  }

  /** Vector search returning at most {@link SearchEngine#DEFAULT_LIMIT} results, without vectors. */
  default CompletableFuture<List<ScoredResult>> search(String collectionName, float[] queryVector) {
    return search(collectionName, null, queryVector, SearchEngine.DEFAULT_LIMIT, false);
  }

  /** Text search with the given limit and no vectors. */
  default CompletableFuture<List<ScoredResult>> search(String collectionName, String queryText, Integer limit) {
    return search(collectionName, queryText, null, limit, false);
  }

  /**
   * Runs one search per text and keeps results with {@code score < scoreThreshold}. The outer list
   * lines up with {@code queryTexts}.
   */
  CompletableFuture<List<List<ScoredResult>>> batchSearch(
      String collectionName, List<String> queryTexts, Integer limit, boolean withVectors, double scoreThreshold);

  /** Batch search without vectors, using {@link SearchEngine#DEFAULT_SCORE_THRESHOLD}. */
  default CompletableFuture<List<List<ScoredResult>>> batchSearch(
      String collectionName, List<String> queryTexts, Integer limit) {
    return batchSearch(collectionName, queryTexts, limit, false, SearchEngine.DEFAULT_SCORE_THRESHOLD);
  }

  /** Deletes documents by id and reports how many actually existed. */
  CompletableFuture<DeleteResult> deleteDataPoints(String collectionName, List<String> dataPointIds);

  /** Drops every collection known to the store. */
  CompletableFuture<Void> prune();

  /** Returns the shared client handle, opening it on first use. */
  CompletableFuture<UnifiedJedis> getConnection();

  /** Closes the client handle; errors while closing are swallowed. */
  @Override
  void close();
}
