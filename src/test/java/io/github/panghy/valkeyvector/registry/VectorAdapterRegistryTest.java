package io.github.panghy.valkeyvector.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.github.panghy.valkeyvector.InitializationException;
import io.github.panghy.valkeyvector.ValkeyVectorAdapter;
import io.github.panghy.valkeyvector.VectorAdapter;
import io.github.panghy.valkeyvector.config.ConnectionUrl;
import io.github.panghy.valkeyvector.testutil.HashingEmbeddingEngine;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class VectorAdapterRegistryTest {

  @Test
  void defaultsRegisterValkey() {
    VectorAdapterRegistry registry = VectorAdapterRegistry.withDefaults();
    assertThat(registry.providers()).containsExactly("valkey");
    assertThat(registry.isRegistered("Valkey")).isTrue();
  }

  @Test
  void createsValkeyAdapterWithoutConnecting() {
    HashingEmbeddingEngine engine = new HashingEmbeddingEngine(4);
    try (VectorAdapter adapter = VectorAdapterRegistry.withDefaults()
        .create("valkey", "valkey://vec.internal:6390", "ignored-key", engine)) {
      assertThat(adapter).isInstanceOf(ValkeyVectorAdapter.class);
      ValkeyVectorAdapter valkey = (ValkeyVectorAdapter) adapter;
      assertThat(valkey.getConfig().getConnectionUrl()).isEqualTo(new ConnectionUrl("vec.internal", 6390));
      assertThat(valkey.getEmbeddingEngine()).isSameAs(engine);
    }
  }

  @Test
  void missingEngineSurfacesInitializationError() {
    assertThatThrownBy(() -> VectorAdapterRegistry.withDefaults().create("valkey", null, null, null))
        .isInstanceOf(InitializationException.class);
  }

  @Test
  void unknownProviderRejected() {
    assertThatThrownBy(() -> VectorAdapterRegistry.withDefaults().create("pgvector", null, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("pgvector");
    assertThatThrownBy(() -> VectorAdapterRegistry.withDefaults().create(null, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void customProvidersReceiveArguments() {
    AtomicReference<String> seen = new AtomicReference<>();
    VectorAdapter stub = mock(VectorAdapter.class);
    VectorAdapterRegistry registry = new VectorAdapterRegistry().register(" Custom ", (url, apiKey, engine) -> {
      seen.set(url + "|" + apiKey);
      return stub;
    });

    assertThat(registry.create("CUSTOM", "u", "k", new HashingEmbeddingEngine(2))).isSameAs(stub);
    assertThat(seen).hasValue("u|k");
  }

  @Test
  void registrationValidated() {
    VectorAdapterRegistry registry = new VectorAdapterRegistry();
    assertThatThrownBy(() -> registry.register(" ", (u, k, e) -> null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> registry.register("x", null)).isInstanceOf(IllegalArgumentException.class);
  }
}
