package io.github.panghy.valkeyvector;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.valkeyvector.api.ScoredResult;
import io.github.panghy.valkeyvector.api.TextChunk;
import io.github.panghy.valkeyvector.config.ValkeyAdapterConfig;
import io.github.panghy.valkeyvector.testutil.HashingEmbeddingEngine;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

/**
 * Runs against a real Valkey server with the search and JSON modules loaded. Enabled only when
 * VALKEY_URL is set, e.g. {@code VALKEY_URL=valkey://localhost:6379}.
 */
@EnabledIfEnvironmentVariable(named = "VALKEY_URL", matches = ".+")
class LiveValkeyIntegrationTest {

  private ValkeyVectorAdapter adapter;
  private String collection;

  @BeforeEach
  void setUp() {
    ValkeyAdapterConfig config =
        ValkeyAdapterConfig.builder().url(System.getenv("VALKEY_URL")).build();
    adapter = new ValkeyVectorAdapter(config, new HashingEmbeddingEngine(32));
    collection = "it_" + UUID.randomUUID().toString().replace("-", "");
  }

  @AfterEach
  void tearDown() throws Exception {
    adapter.getConnection()
        .thenAccept(client -> client.ftDropIndex("index:" + collection))
        .exceptionally(ex -> null)
        .get(10, TimeUnit.SECONDS);
    adapter.close();
  }

  @Test
  void insertSearchRetrieveDelete() throws Exception {
    UUID a = UUID.randomUUID();
    UUID b = UUID.randomUUID();
    adapter.createCollection(collection).get(10, TimeUnit.SECONDS);
    adapter.createCollection(collection).get(10, TimeUnit.SECONDS);
    assertThat(adapter.hasCollection(collection).get(10, TimeUnit.SECONDS)).isTrue();

    adapter.createDataPoints(
            collection, List.of(TextChunk.of(a, "red apples and pears"), TextChunk.of(b, "network packet routing")))
        .get(10, TimeUnit.SECONDS);

    List<ScoredResult> hits = adapter.search(collection, "red apples and pears", 2).get(10, TimeUnit.SECONDS);
    assertThat(hits).isNotEmpty();
    assertThat(hits.get(0).id()).isEqualTo(a.toString());
    assertThat(hits).extracting(ScoredResult::score).isSorted();

    List<Map<String, Object>> payloads = adapter.retrieve(collection, List.of(b.toString())).get(10, TimeUnit.SECONDS);
    assertThat(payloads).singleElement().satisfies(p -> assertThat(p).containsEntry("text", "network packet routing"));

    assertThat(adapter.deleteDataPoints(collection, List.of(a.toString(), b.toString(), "x"))
            .get(10, TimeUnit.SECONDS)
            .deleted())
        .isEqualTo(2L);
  }
}
