package io.github.panghy.valkeyvector.mutation;

import static java.util.concurrent.CompletableFuture.allOf;
import static java.util.concurrent.CompletableFuture.completedFuture;

import io.github.panghy.valkeyvector.CollectionNotFoundException;
import io.github.panghy.valkeyvector.api.DataPoint;
import io.github.panghy.valkeyvector.api.DeleteResult;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;
import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.codec.StorageDocument;
import io.github.panghy.valkeyvector.connection.ConnectionManager;
import io.github.panghy.valkeyvector.schema.CollectionNames;
import io.github.panghy.valkeyvector.schema.IndexManager;
import io.github.panghy.valkeyvector.util.AdapterMetrics;
import io.github.panghy.valkeyvector.util.Futures;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.json.JsonProtocol.JsonCommand;
import redis.clients.jedis.json.Path;
import redis.clients.jedis.json.Path2;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.util.SafeEncoder;

/**
 * Writes, reads and removes stored documents.
 *
 * <p>Inserts embed the whole batch with one call and write every document concurrently; the batch
 * is not atomic, so a failure part way through can leave some documents written.</p>
 */
public final class MutationEngine {

  private static final Logger LOG = LoggerFactory.getLogger(MutationEngine.class);

  static final int SCAN_COUNT = 500;

  private final ConnectionManager connections;
  private final IndexManager indexes;
  private final DocumentCodec codec;
  private final EmbeddingEngine embeddings;
  private final AdapterMetrics metrics;

  public MutationEngine(
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
   * Embeds and stores data points.
   *
   * @return a future failing with {@link CollectionNotFoundException} if the collection does not
   *         exist; an empty list completes without any write
   */
  public CompletableFuture<Void> createDataPoints(String collection, List<? extends DataPoint> points) {
    return indexes.hasCollection(collection)
        .thenCompose(exists -> {
          if (!exists) return CompletableFuture.<Void>failedFuture(new CollectionNotFoundException(collection));
          if (points.isEmpty()) return completedFuture((Void) null);
          List<String> texts = new ArrayList<>(points.size());
          for (DataPoint p : points) texts.add(p.getEmbeddableText());
          return embeddings.embedText(texts).thenCompose(vectors -> writeAll(collection, points, vectors));
        })
        .whenComplete((v, ex) -> {
          if (ex != null) {
            LOG.error("Error creating data points in {}: {}", collection, Futures.unwrap(ex).toString());
          }
        });
  }

  private CompletableFuture<Void> writeAll(
      String collection, List<? extends DataPoint> points, List<float[]> vectors) {
    if (vectors == null || vectors.size() != points.size()) {
      throw new IllegalStateException("Embedding engine returned "
          + (vectors == null ? 0 : vectors.size()) + " vectors for " + points.size() + " texts");
    }
    int dim = embeddings.getVectorSize();
    List<CompletableFuture<String>> writes = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      float[] vector = vectors.get(i);
      if (vector.length != dim) {
        throw new IllegalArgumentException(
            "Vector for " + points.get(i).getId() + " has " + vector.length + " elements, expected " + dim);
      }
      StorageDocument doc = codec.encode(points.get(i), vector);
      String key = CollectionNames.key(collection, doc.id());
      String json = codec.toJson(doc);
      writes.add(connections.call(client -> client.jsonSetWithPlainString(key, Path.ROOT_PATH, json)));
    }
    return allOf(writes.toArray(CompletableFuture[]::new)).thenRun(() -> {
      metrics.recordInserted(collection, points.size());
      LOG.debug("Stored {} data point(s) in {}", points.size(), collection);
    });
  }

  /**
   * Fetches stored payloads by id, in input order; ids with no document are skipped.
   *
   * <p>Best-effort: any failure is logged and yields an empty list.</p>
   */
  public CompletableFuture<List<Map<String, Object>>> retrieve(String collection, List<String> ids) {
    List<CompletableFuture<Optional<Map<String, Object>>>> reads = new ArrayList<>(ids.size());
    for (String id : ids) {
      byte[] key = SafeEncoder.encode(CollectionNames.key(collection, id));
      reads.add(connections
          .call(client -> client.sendCommand(JsonCommand.GET, key, SafeEncoder.encode(Path2.ROOT_PATH.toString())))
          .thenApply(codec::decodeRetrieved));
    }
    return allOf(reads.toArray(CompletableFuture[]::new))
        .thenApply(v -> {
          List<Map<String, Object>> out = new ArrayList<>(reads.size());
          for (CompletableFuture<Optional<Map<String, Object>>> f : reads) f.join().ifPresent(out::add);
          return out;
        })
        .exceptionally(ex -> {
          LOG.error("Error retrieving data points from {}: {}", collection, Futures.unwrap(ex).toString());
          return List.of();
        });
  }

  /**
   * Deletes documents by id with one bulk command.
   *
   * @return the number of documents actually removed
   */
  public CompletableFuture<DeleteResult> deleteDataPoints(String collection, List<String> ids) {
    if (ids.isEmpty()) return completedFuture(new DeleteResult(0));
    String[] keys = ids.stream().map(id -> CollectionNames.key(collection, id)).toArray(String[]::new);
    return connections
        .call(client -> client.del(keys))
        .thenApply(deleted -> {
          LOG.info("Deleted {} data points from collection {}", deleted, collection);
          metrics.recordDeleted(collection, deleted);
          return new DeleteResult(deleted);
        })
        .whenComplete((r, ex) -> {
          if (ex != null) LOG.error("Error deleting data points: {}", Futures.unwrap(ex).toString());
        });
  }

  /**
   * Drops every index known to the store, one at a time. After an index named for a collection
   * is dropped, the documents under that collection's key prefix are deleted too. The first
   * failure stops the prune; work already done is not rolled back.
   */
  public CompletableFuture<Void> prune() {
    return indexes.listIndexes()
        .thenCompose(all -> {
          CompletableFuture<Void> chain = completedFuture(null);
          for (String index : new ArrayList<>(all)) chain = chain.thenCompose(v -> pruneIndex(index));
          return chain;
        })
        .whenComplete((v, ex) -> {
          if (ex != null) LOG.error("Error during prune: {}", Futures.unwrap(ex).toString());
        });
  }

  private CompletableFuture<Void> pruneIndex(String index) {
    return indexes.dropIndex(index).thenCompose(v -> {
      metrics.recordIndexDropped();
      Optional<String> collection = CollectionNames.collectionOf(index);
      if (collection.isEmpty()) return completedFuture(null);
      return connections
          .call(client -> deleteKeys(client, CollectionNames.keyPattern(collection.get())))
          .thenAccept(n -> LOG.info("Deleted {} document(s) of pruned collection {}", n, collection.get()));
    });
  }

  private static long deleteKeys(UnifiedJedis client, String pattern) {
    ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
    String cursor = ScanParams.SCAN_POINTER_START;
    long deleted = 0;
    do {
      ScanResult<String> page = client.scan(cursor, params);
      List<String> keys = page.getResult();
      if (!keys.isEmpty()) deleted += client.del(keys.toArray(new String[0]));
      cursor = page.getCursor();
    } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
    return deleted;
  }
}
