package io.github.panghy.valkeyvector.schema;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.ibm.asyncutil.locks.AsyncLock;
import io.github.panghy.valkeyvector.ProtocolException;
import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.connection.ConnectionManager;
import io.github.panghy.valkeyvector.util.Futures;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.exceptions.JedisDataException;

/**
 * Creates, inspects and drops collection indexes.
 *
 * <p>Creation is serialized by a per-instance async lock so that concurrent creators of the same
 * collection issue a single {@code FT.CREATE}. Lookups never fail: an unknown index and a failed
 * metadata call are both reported through {@link IndexLookup}.</p>
 */
public final class IndexManager {

  private static final Logger LOG = LoggerFactory.getLogger(IndexManager.class);

  private final ConnectionManager connections;
  private final IntSupplier dimension;
  private final AsyncLock creationLock = AsyncLock.createFair();

  /**
   * @param connections connection manager of the owning adapter
   * @param dimension   supplies the vector dimensionality of new indexes
   */
  public IndexManager(ConnectionManager connections, IntSupplier dimension) {
    this.connections = connections;
    this.dimension = dimension;
  }

  /** Looks up index metadata for a collection. The returned future never fails. */
  public CompletableFuture<IndexLookup> lookup(String collection) {
    String index = CollectionNames.indexName(collection);
    return connections.call(client -> client.ftInfo(index)).handle((info, ex) -> {
      if (ex == null) return IndexLookup.found(info);
      Throwable cause = Futures.unwrap(ex);
      if (isUnknownIndex(cause)) return IndexLookup.notFound();
      LOG.warn("FT.INFO {} failed: {}", index, cause.toString());
      return IndexLookup.error(cause);
    });
  }

  static boolean isUnknownIndex(Throwable t) {
    if (!(t instanceof JedisDataException) || t.getMessage() == null) return false;
    String msg = t.getMessage().toLowerCase(Locale.ROOT);
    return msg.contains("unknown index") || msg.contains("no such index") || msg.contains("not found");
  }

  /** Returns true only if the collection's index was found; never fails. */
  public CompletableFuture<Boolean> hasCollection(String collection) {
    return lookup(collection).thenApply(IndexLookup::exists);
  }

  /**
   * Returns the number of documents currently indexed for the collection, 0 if it does not exist.
   * Fails if the metadata lookup itself failed.
   */
  public CompletableFuture<Long> documentCount(String collection) {
    return lookup(collection).thenCompose(lookup -> switch (lookup.status()) {
      case FOUND -> completedFuture(numDocs(lookup.info()));
      case NOT_FOUND -> completedFuture(0L);
      case ERROR -> CompletableFuture.<Long>failedFuture(lookup.error());
    });
  }

  static long numDocs(Map<String, Object> info) {
    Object raw = info.get("num_docs");
    if (raw instanceof Number n) return n.longValue();
    if (raw == null) return 0L;
    String s = DocumentCodec.text(raw);
    try {
      return (long) Double.parseDouble(s.trim());
    } catch (NumberFormatException e) {
      throw new ProtocolException("Unexpected num_docs value: " + s, e);
    }
  }

  /**
   * Creates the collection's index unless it already exists.
   *
   * <p>A caller-supplied payload schema is accepted for interface compatibility but not used; the
   * index definition is always {@link IndexSchema#forCollection(String, int)}.</p>
   *
   * @throws ProtocolException (via the future) if {@code FT.CREATE} is not acknowledged with OK
   */
  public CompletableFuture<Void> createCollection(String collection, Map<String, Object> payloadSchema) {
    if (payloadSchema != null) LOG.debug("Ignoring payload schema for collection {}", collection);
    return creationLock.acquireLock().toCompletableFuture().thenCompose(token -> {
      CompletableFuture<Void> created;
      try {
        created = createIfAbsent(collection);
      } catch (RuntimeException e) {
        created = CompletableFuture.failedFuture(e);
      }
      return created.whenComplete((v, ex) -> token.releaseLock());
    });
  }

  private CompletableFuture<Void> createIfAbsent(String collection) {
    return hasCollection(collection)
        .thenCompose(exists -> {
          if (exists) {
            LOG.info("Collection {} already exists", collection);
            return completedFuture(null);
          }
          IndexSchema schema = IndexSchema.forCollection(collection, dimension.getAsInt());
          return connections
              .call(client -> client.ftCreate(schema.indexName(), schema.createParams(), schema.fields()))
              .thenAccept(ack -> {
                if (!"OK".equalsIgnoreCase(ack)) {
                  throw new ProtocolException(
                      "FT.CREATE failed for index '" + schema.indexName() + "': " + ack);
                }
                LOG.info(
                    "Created collection {} (index={}, dim={})",
                    collection,
                    schema.indexName(),
                    schema.dimension());
              });
        })
        .whenComplete((v, ex) -> {
          if (ex != null) {
            LOG.error("Error creating collection {}: {}", collection, Futures.unwrap(ex).toString());
          }
        });
  }

  /** Lists the names of all indexes known to the store. */
  public CompletableFuture<Set<String>> listIndexes() {
    return connections.call(client -> client.ftList());
  }

  /** Drops an index; documents it covered are left in place. */
  public CompletableFuture<Void> dropIndex(String indexName) {
    return connections
        .call(client -> client.ftDropIndex(indexName))
        .thenAccept(ack -> LOG.info("Dropped index {}", indexName));
  }
}
