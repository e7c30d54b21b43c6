package io.github.panghy.valkeyvector.connection;

import io.github.panghy.valkeyvector.VectorAdapterException;
import io.github.panghy.valkeyvector.config.ConnectionUrl;
import io.github.panghy.valkeyvector.config.ReconnectPolicy;
import io.github.panghy.valkeyvector.config.ValkeyAdapterConfig;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.RedisProtocol;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Owns the single client handle of an adapter instance.
 *
 * <p>The handle is created lazily on first use and cached until {@link #close()}. Concurrent first
 * callers share one in-flight open, so at most one live handle exists per manager. A failed open is
 * forgotten and the next call tries again. There is no health checking: a handle that breaks
 * mid-session is only replaced after an explicit {@link #close()}.</p>
 *
 * <p>Opening pings the server and retries according to the configured {@link ReconnectPolicy}.</p>
 */
public final class ConnectionManager implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);
  private static final String CLIENT_NAME = "valkey-vector-adapter";

  private final ValkeyAdapterConfig config;
  private final AtomicReference<CompletableFuture<UnifiedJedis>> current = new AtomicReference<>();

  public ConnectionManager(ValkeyAdapterConfig config) {
    this.config = config;
  }

  /**
   * Returns the cached handle, opening one if none is connected.
   *
   * @return a future with a connected handle
   */
  public CompletableFuture<UnifiedJedis> getConnection() {
    while (true) {
      CompletableFuture<UnifiedJedis> existing = current.get();
      if (existing != null && !existing.isCompletedExceptionally()) return existing;
      CompletableFuture<UnifiedJedis> opening = new CompletableFuture<>();
      if (current.compareAndSet(existing, opening)) {
        startOpen(opening);
        return opening;
      }
    }
  }

  /**
   * Runs a blocking client call on the configured executor once a handle is available.
   *
   * @param command the call to run against the handle
   * @return a future with the call's result
   */
  public <T> CompletableFuture<T> call(Function<UnifiedJedis, T> command) {
    return getConnection().thenApplyAsync(command, config.getExecutor());
  }

  /** Returns true if a handle has been opened and not closed since. */
  public boolean isConnected() {
    CompletableFuture<UnifiedJedis> f = current.get();
    return f != null && f.isDone() && !f.isCompletedExceptionally();
  }

  /**
   * Closes the handle, if any, and resets to the disconnected state. Errors raised while closing are
   * logged and swallowed. An open still in flight is closed once it completes.
   */
  @Override
  public void close() {
    CompletableFuture<UnifiedJedis> f = current.getAndSet(null);
    if (f == null) return;
    f.thenAccept(this::closeQuietly);
  }

  private void startOpen(CompletableFuture<UnifiedJedis> opening) {
    try {
      config.getExecutor().execute(() -> {
        try {
          opening.complete(open());
        } catch (Throwable t) {
          current.compareAndSet(opening, null);
          opening.completeExceptionally(t);
        }
      });
    } catch (RejectedExecutionException e) {
      current.compareAndSet(opening, null);
      opening.completeExceptionally(e);
    }
  }

  private UnifiedJedis open() {
    ConnectionUrl url = config.getConnectionUrl();
    UnifiedJedis client = config.getClientFactory().create(url, clientConfig());
    ReconnectPolicy policy = config.getReconnectPolicy();
    for (int attempt = 0; ; attempt++) {
      try {
        client.ping();
        LOG.info("Connected to {} (tls={})", url, config.isUseTls());
        return client;
      } catch (JedisException e) {
        if (attempt >= policy.retries()) {
          LOG.error("Could not connect to {} after {} attempt(s): {}", url, attempt + 1, e.getMessage());
          closeQuietly(client);
          throw e;
        }
        Duration delay = policy.delayForAttempt(attempt);
        LOG.warn(
            "Ping to {} failed (attempt {}/{}), retrying in {} ms",
            url,
            attempt + 1,
            policy.retries() + 1,
            delay.toMillis());
        sleep(delay, client);
      }
    }
  }

  private JedisClientConfig clientConfig() {
    int timeoutMs = (int) config.getRequestTimeout().toMillis();
    return DefaultJedisClientConfig.builder()
        .connectionTimeoutMillis(timeoutMs)
        .socketTimeoutMillis(timeoutMs)
        .ssl(config.isUseTls())
        .protocol(RedisProtocol.RESP2)
        .clientName(CLIENT_NAME)
        .build();
  }

  private void sleep(Duration delay, UnifiedJedis client) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      closeQuietly(client);
      throw new VectorAdapterException("Interrupted while reconnecting to " + config.getConnectionUrl(), e);
    }
  }

  private void closeQuietly(UnifiedJedis client) {
    try {
      client.close();
    } catch (Exception e) {
      LOG.debug("Ignoring error while closing client: {}", e.getMessage());
    }
  }
}
