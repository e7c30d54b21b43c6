package io.github.panghy.valkeyvector.search;

import static java.util.concurrent.CompletableFuture.allOf;
import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.valkeyvector.MissingQueryParameterException;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;
import io.github.panghy.valkeyvector.api.ScoredResult;
import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.codec.SearchReplies;
import io.github.panghy.valkeyvector.connection.ConnectionManager;
import io.github.panghy.valkeyvector.schema.CollectionNames;
import io.github.panghy.valkeyvector.schema.IndexManager;
import io.github.panghy.valkeyvector.util.AdapterMetrics;
import io.github.panghy.valkeyvector.util.Futures;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.search.SearchProtocol.SearchCommand;

/**
 * Executes KNN searches, single and batched.
 *
 * <p>Scores are cosine distances: lower is more similar. Results are returned in ascending score
 * order with unscored results last.</p>
 */
public final class SearchEngine {

  private static final Logger LOG = LoggerFactory.getLogger(SearchEngine.class);

  public static final int DEFAULT_LIMIT = 15;
  public static final double DEFAULT_SCORE_THRESHOLD = 0.1;

  static final Comparator<ScoredResult> BY_SCORE =
      Comparator.comparing(ScoredResult::score, Comparator.nullsLast(Comparator.naturalOrder()));

  private final ConnectionManager connections;
  private final IndexManager indexes;
  private final DocumentCodec codec;
  private final EmbeddingEngine embeddings;
  private final AdapterMetrics metrics;

  public SearchEngine(
      ConnectionManager connections,
      IndexManager indexes,
      DocumentCodec codec,
      EmbeddingEngine embeddings,
      AdapterMetrics metrics) {
    this.connections = connections;
    this.indexes = indexes;
    this.codec = codec;
    this.embeddings = embeddings;
    this.metrics = metrics;
  }

  /**
   * Finds the nearest neighbors of a text or vector.
   *
   * <ul>
   *   <li>Fails with {@link MissingQueryParameterException} if both {@code queryText} and
   *       {@code queryVector} are null.</li>
   *   <li>Returns an empty list if the collection does not exist.</li>
   *   <li>A null {@code limit} means "every document in the collection"; a resolved limit of 0 or
   *       less returns an empty list without querying.</li>
   *   <li>{@code queryVector} wins over {@code queryText} when both are given.</li>
   * </ul>
   */
  public CompletableFuture<List<ScoredResult>> search(
      String collection, String queryText, float[] queryVector, Integer limit, boolean withVector) {
    if (queryText == null && queryVector == null) {
      return CompletableFuture.failedFuture(new MissingQueryParameterException());
    }
    return indexes.hasCollection(collection).thenCompose(exists -> {
      if (!exists) {
        LOG.warn("Collection '{}' not found in search; returning []", collection);
        return completedFuture(List.<ScoredResult>of());
      }
      return resolveLimit(collection, limit).thenCompose(k -> {
        if (k <= 0) return completedFuture(List.<ScoredResult>of());
        return resolveVector(queryText, queryVector)
            .thenCompose(vector -> execute(collection, new KnnQuery(
                CollectionNames.indexName(collection), k, vector, withVector)));
      });
    });
  }

  private CompletableFuture<Integer> resolveLimit(String collection, Integer limit) {
    if (limit != null) return completedFuture(limit);
    return indexes.documentCount(collection).thenApply(n -> (int) Math.min(n, Integer.MAX_VALUE));
  }

  private CompletableFuture<float[]> resolveVector(String queryText, float[] queryVector) {
    if (queryVector != null) return completedFuture(queryVector);
    return embeddings.embedText(List.of(queryText)).thenApply(vectors -> {
      if (vectors == null || vectors.size() != 1) {
        throw new IllegalStateException("Embedding engine returned "
            + (vectors == null ? 0 : vectors.size()) + " vectors for 1 text");
      }
      return vectors.get(0);
    });
  }

  CompletableFuture<List<ScoredResult>> execute(String collection, KnnQuery query) {
    long start = System.nanoTime();
    return connections
        .call(client -> client.sendCommand(SearchCommand.SEARCH, query.toArgs()))
        .thenApply(raw -> {
          List<ScoredResult> results = new ArrayList<>(codec.decodeSearch(SearchReplies.toPair(raw)));
          results.sort(BY_SCORE);
          return results;
        })
        .whenComplete((results, ex) -> {
          if (ex != null) {
            LOG.error(
                "Error during search on collection {} (k={}): {}",
                collection,
                query.k(),
                Futures.unwrap(ex).toString());
          } else {
            metrics.recordQuery(collection, start);
            LOG.debug("Search on {} returned {} result(s)", collection, results.size());
          }
        });
  }

  /**
   * Runs one search per text, embedding all texts in a single call and issuing the searches
   * concurrently.
   *
   * <p>Each query's results are filtered to {@code score < scoreThreshold}; results without a
   * score are dropped. The returned lists line up with {@code queryTexts}, and a query with no
   * passing result yields an empty list. Returns an empty list if the collection does not exist.
   * If any single search fails, the whole batch fails, as does an embedding reply whose vector
   * count differs from the number of texts.</p>
   */
  public CompletableFuture<List<List<ScoredResult>>> batchSearch(
      String collection, List<String> queryTexts, Integer limit, boolean withVectors, double scoreThreshold) {
    return indexes.hasCollection(collection).thenCompose(exists -> {
      if (!exists) {
        LOG.warn("Collection '{}' not found in batch search; returning []", collection);
        return completedFuture(List.<List<ScoredResult>>of());
      }
      if (queryTexts.isEmpty()) return completedFuture(List.<List<ScoredResult>>of());
      return embeddings.embedText(queryTexts).thenCompose(vectors -> {
        if (vectors == null || vectors.size() != queryTexts.size()) {
          throw new IllegalStateException("Embedding engine returned "
              + (vectors == null ? 0 : vectors.size()) + " vectors for " + queryTexts.size() + " texts");
        }
        List<CompletableFuture<List<ScoredResult>>> searches = new ArrayList<>(vectors.size());
        for (float[] vector : vectors) searches.add(search(collection, null, vector, limit, withVectors));
        return allOf(searches.toArray(CompletableFuture[]::new)).thenApply(v -> {
          List<List<ScoredResult>> out = new ArrayList<>(searches.size());
          for (CompletableFuture<List<ScoredResult>> f : searches) {
            out.add(f.join().stream()
                .filter(r -> r.score() != null && r.score() < scoreThreshold)
                .toList());
          }
          return out;
        });
      });
    });
  }
}
