package io.github.panghy.valkeyvector;

import io.github.panghy.valkeyvector.api.DataPoint;
import io.github.panghy.valkeyvector.api.DeleteResult;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;
import io.github.panghy.valkeyvector.api.ScoredResult;
import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.config.ValkeyAdapterConfig;
import io.github.panghy.valkeyvector.connection.ConnectionManager;
import io.github.panghy.valkeyvector.mutation.MutationEngine;
import io.github.panghy.valkeyvector.schema.IndexManager;
import io.github.panghy.valkeyvector.search.SearchEngine;
import io.github.panghy.valkeyvector.util.AdapterMetrics;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import redis.clients.jedis.UnifiedJedis;

// Valkey implementation of VectorAdapter. See VectorAdapter for API documentation.
public class ValkeyVectorAdapter implements VectorAdapter {

  public static final String PROVIDER = "valkey";

  private final ValkeyAdapterConfig config;
  private final EmbeddingEngine embeddingEngine;
  private final ConnectionManager connections;
  private final IndexManager indexes;
  private final SearchEngine searchEngine;
  private final MutationEngine mutationEngine;

  /**
   * @throws InitializationException if {@code embeddingEngine} is null
   */
  public ValkeyVectorAdapter(ValkeyAdapterConfig config, EmbeddingEngine embeddingEngine) {
    if (embeddingEngine == null) {
      throw new InitializationException(
          "Embedding engine is required. Provide an EmbeddingEngine to the Valkey adapter.");
    }
    if (config == null) throw new InitializationException("config must not be null");
    this.config = config;
    this.embeddingEngine = embeddingEngine;
    AdapterMetrics metrics = new AdapterMetrics(config.getMetricAttributes());
    DocumentCodec codec = new DocumentCodec();
    this.connections = new ConnectionManager(config);
    this.indexes = new IndexManager(connections, embeddingEngine::getVectorSize);
    this.searchEngine = new SearchEngine(connections, indexes, codec, embeddingEngine, metrics);
    this.mutationEngine = new MutationEngine(connections, indexes, codec, embeddingEngine, metrics);
  }

  public ValkeyAdapterConfig getConfig() {
    return config;
  }

  public EmbeddingEngine getEmbeddingEngine() {
    return embeddingEngine;
  }

  @Override
  public CompletableFuture<Boolean> hasCollection(String collectionName) {
    return indexes.hasCollection(collectionName);
  }

  @Override
  public CompletableFuture<Void> createCollection(String collectionName, Map<String, Object> payloadSchema) {
    return indexes.createCollection(collectionName, payloadSchema);
  }

  @Override
  public CompletableFuture<Void> createDataPoints(String collectionName, List<? extends DataPoint> dataPoints) {
    return mutationEngine.createDataPoints(collectionName, dataPoints);
  }

  @Override
  public CompletableFuture<List<Map<String, Object>>> retrieve(String collectionName, List<String> dataPointIds) {
    return mutationEngine.retrieve(collectionName, dataPointIds);
  }

  @Override
  public CompletableFuture<List<ScoredResult>> search(
      String collectionName, String queryText, float[] queryVector, Integer limit, boolean withVector) {
    return searchEngine.search(collectionName, queryText, queryVector, limit, withVector);
  }

  @Override
  public CompletableFuture<List<List<ScoredResult>>> batchSearch(
      String collectionName, List<String> queryTexts, Integer limit, boolean withVectors, double scoreThreshold) {
    return searchEngine.batchSearch(collectionName, queryTexts, limit, withVectors, scoreThreshold);
  }

  @Override
  public CompletableFuture<DeleteResult> deleteDataPoints(String collectionName, List<String> dataPointIds) {
    return mutationEngine.deleteDataPoints(collectionName, dataPointIds);
  }

  @Override
  public CompletableFuture<Void> prune() {
    return mutationEngine.prune();
  }

  @Override
  public CompletableFuture<UnifiedJedis> getConnection() {
    return connections.getConnection();
  }

  @Override
  public void close() {
    connections.close();
  }
}
