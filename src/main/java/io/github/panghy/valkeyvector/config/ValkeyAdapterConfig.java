package io.github.panghy.valkeyvector.config;

import io.github.panghy.valkeyvector.connection.ValkeyClientFactory;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Configuration for a Valkey-backed vector adapter.
 *
 * <p>Built with {@link #builder()}; validates inputs and exposes getters only. The config carries
 * connection settings (URL, TLS, request timeout, reconnect policy) and operational settings
 * (the executor running blocking client calls, the client factory, metric attributes).</p>
 *
 * <pre>{@code
 * ValkeyAdapterConfig config = ValkeyAdapterConfig.builder()
 *     .url("valkey://localhost:6379")
 *     .requestTimeout(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 */
public final class ValkeyAdapterConfig {

  public static final String URL_ENV = "VECTOR_DB_URL";
  public static final String DEFAULT_URL = "valkey://localhost:6379";

  private final String url;
  private final ConnectionUrl connectionUrl;
  private final boolean useTls;
  private final Duration requestTimeout;
  private final ReconnectPolicy reconnectPolicy;
  private final Executor executor;
  private final ValkeyClientFactory clientFactory;
  private final Map<String, String> metricAttributes;

  private ValkeyAdapterConfig(Builder b) {
    this.url = b.url;
    this.connectionUrl = ConnectionUrl.parse(b.url);
    this.useTls = b.useTls;
    this.requestTimeout = requirePositive(b.requestTimeout, "requestTimeout");
    if (requestTimeout.toMillis() > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("requestTimeout too large");
    }
    this.reconnectPolicy = Objects.requireNonNull(b.reconnectPolicy, "reconnectPolicy must not be null");
    this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
    this.clientFactory = Objects.requireNonNull(b.clientFactory, "clientFactory must not be null");
    this.metricAttributes = Map.copyOf(b.metricAttributes);
  }

  private static Duration requirePositive(Duration d, String name) {
    if (d == null) throw new IllegalArgumentException(name + " must not be null");
    if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    return d;
  }

  /**
   * Builds a config from environment-style variables, reading the URL from {@value #URL_ENV}
   * and falling back to {@value #DEFAULT_URL}.
   */
  public static ValkeyAdapterConfig fromEnvironment(Map<String, String> env) {
    String url = env == null ? null : env.get(URL_ENV);
    return builder().url(url == null || url.isBlank() ? DEFAULT_URL : url).build();
  }

  /** Returns the connection URL as supplied (may be {@code null}). */
  public String getUrl() {
    return url;
  }

  /** Returns the parsed host and port. */
  public ConnectionUrl getConnectionUrl() {
    return connectionUrl;
  }

  /** Returns whether connections use TLS. */
  public boolean isUseTls() {
    return useTls;
  }

  /** Returns the per-request timeout. */
  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /** Returns the policy applied while opening a connection. */
  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  /** Returns the executor running blocking client calls. */
  public Executor getExecutor() {
    return executor;
  }

  /** Returns the factory used to create client handles. */
  public ValkeyClientFactory getClientFactory() {
    return clientFactory;
  }

  /** Additional attributes added to emitted metrics. */
  public Map<String, String> getMetricAttributes() {
    return metricAttributes;
  }

  /** Creates a new builder for {@link ValkeyAdapterConfig}. */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ValkeyAdapterConfig}. */
  public static final class Builder {
    private String url;
    private boolean useTls = false;
    private Duration requestTimeout = Duration.ofMillis(5000);
    private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
    private Executor executor = ForkJoinPool.commonPool();
    private ValkeyClientFactory clientFactory = ValkeyClientFactory.pooled();
    private final Map<String, String> metricAttributes = new HashMap<>();

    private Builder() {}

    /** Sets the connection URL ({@code scheme://host:port}); {@code null} means localhost:6379. */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /** Enables or disables TLS. */
    public Builder useTls(boolean useTls) {
      this.useTls = useTls;
      return this;
    }

    /** Sets the per-request timeout. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /** Sets the reconnect policy. */
    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets the executor that runs blocking client calls. Defaults to
     * {@link ForkJoinPool#commonPool()}; reconnect backoff sleeps also run on
     * it, so production callers should supply a dedicated pool sized for blocking I/O. The adapter
     * does not shut down a supplied executor.
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /** Sets the factory used to create client handles. */
    public Builder clientFactory(ValkeyClientFactory clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    /** Adds a metric attribute (key/value) to be included on metrics. */
    public Builder metricAttribute(String key, String value) {
      this.metricAttributes.put(key, value);
      return this;
    }

    /** Builds the immutable {@link ValkeyAdapterConfig}. */
    public ValkeyAdapterConfig build() {
      return new ValkeyAdapterConfig(this);
    }
  }
}
