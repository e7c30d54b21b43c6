package io.github.panghy.valkeyvector.registry;

import io.github.panghy.valkeyvector.ValkeyVectorAdapter;
import io.github.panghy.valkeyvector.VectorAdapter;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;
import io.github.panghy.valkeyvector.config.ValkeyAdapterConfig;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps provider names to adapter factories. Owned by whichever service coordinates vector stores
 * and populated at startup; provider names are case-insensitive.
 */
public final class VectorAdapterRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(VectorAdapterRegistry.class);

  private final Map<String, VectorAdapterFactory> factories = new ConcurrentHashMap<>();

  /** Returns a registry with the built-in {@value ValkeyVectorAdapter#PROVIDER} provider. */
  public static VectorAdapterRegistry withDefaults() {
    VectorAdapterRegistry registry = new VectorAdapterRegistry();
    registry.register(ValkeyVectorAdapter.PROVIDER, (url, apiKey, engine) ->
        new ValkeyVectorAdapter(ValkeyAdapterConfig.builder().url(url).build(), engine));
    return registry;
  }

  /**
   * Registers a provider, replacing any earlier registration under the same name.
   *
   * @return this registry
   */
  public VectorAdapterRegistry register(String provider, VectorAdapterFactory factory) {
    if (provider == null || provider.isBlank()) throw new IllegalArgumentException("provider must not be blank");
    if (factory == null) throw new IllegalArgumentException("factory must not be null");
    VectorAdapterFactory previous = factories.put(normalize(provider), factory);
    if (previous != null) LOG.info("Replaced vector adapter provider {}", provider);
    return this;
  }

  public boolean isRegistered(String provider) {
    return provider != null && factories.containsKey(normalize(provider));
  }

  public Set<String> providers() {
    return new TreeSet<>(factories.keySet());
  }

  /**
   * Creates an adapter with the named provider.
   *
   * @throws IllegalArgumentException if no provider is registered under that name
   */
  public VectorAdapter create(String provider, String url, String apiKey, EmbeddingEngine embeddingEngine) {
    VectorAdapterFactory factory = provider == null ? null : factories.get(normalize(provider));
    if (factory == null) {
      throw new IllegalArgumentException("Unknown vector adapter provider: " + provider + " (known: " + providers() + ")");
    }
    return factory.create(url, apiKey, embeddingEngine);
  }

  private static String normalize(String provider) {
    return provider.trim().toLowerCase(Locale.ROOT);
  }
}
