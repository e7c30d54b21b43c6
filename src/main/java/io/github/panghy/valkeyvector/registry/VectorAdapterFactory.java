package io.github.panghy.valkeyvector.registry;

import io.github.panghy.valkeyvector.VectorAdapter;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;

/** Creates a {@link VectorAdapter} for one provider. */
@FunctionalInterface
public interface VectorAdapterFactory {

  /**
   * @param url             connection URL of the store, may be null for provider defaults
   * @param apiKey          credential, may be null; providers that do not need one ignore it
   * @param embeddingEngine engine used by the adapter
   */
  VectorAdapter create(String url, String apiKey, EmbeddingEngine embeddingEngine);
}
