package io.github.panghy.valkeyvector.search;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.panghy.valkeyvector.MissingQueryParameterException;
import io.github.panghy.valkeyvector.api.EmbeddingEngine;
import io.github.panghy.valkeyvector.api.ScoredResult;
import io.github.panghy.valkeyvector.api.TextChunk;
import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.config.ReconnectPolicy;
import io.github.panghy.valkeyvector.config.ValkeyAdapterConfig;
import io.github.panghy.valkeyvector.connection.ConnectionManager;
import io.github.panghy.valkeyvector.mutation.MutationEngine;
import io.github.panghy.valkeyvector.schema.IndexManager;
import io.github.panghy.valkeyvector.testutil.FakeValkey;
import io.github.panghy.valkeyvector.testutil.HashingEmbeddingEngine;
import io.github.panghy.valkeyvector.util.AdapterMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.commands.ProtocolCommand;
import redis.clients.jedis.exceptions.JedisDataException;

class SearchEngineTest {

  private static final int DIM = 64;

  private final UUID fruitId = UUID.randomUUID();
  private final UUID physicsId = UUID.randomUUID();
  private final UUID valkeyId = UUID.randomUUID();

  private FakeValkey fake;
  private HashingEmbeddingEngine embeddings;
  private SearchEngine search;

  @BeforeEach
  void setUp() throws Exception {
    fake = new FakeValkey();
    embeddings = new HashingEmbeddingEngine(DIM);
    search = engineFor(fake.config());
    ConnectionManager connections = new ConnectionManager(fake.config());
    IndexManager indexes = new IndexManager(connections, embeddings::getVectorSize);
    MutationEngine mutations = new MutationEngine(
        connections, indexes, new DocumentCodec(), embeddings, new AdapterMetrics(Map.of()));
    indexes.createCollection("docs", null).get(5, TimeUnit.SECONDS);
    indexes.createCollection("empty", null).get(5, TimeUnit.SECONDS);
    mutations
        .createDataPoints(
            "docs",
            List.of(
                TextChunk.of(fruitId, "apple banana cherry"),
                TextChunk.of(physicsId, "quantum physics lecture"),
                TextChunk.of(valkeyId, "valkey vector search")))
        .get(5, TimeUnit.SECONDS);
  }

  private SearchEngine engineFor(ValkeyAdapterConfig config) {
    return engineFor(config, embeddings);
  }

  private SearchEngine engineFor(ValkeyAdapterConfig config, EmbeddingEngine engine) {
    ConnectionManager connections = new ConnectionManager(config);
    IndexManager indexes = new IndexManager(connections, engine::getVectorSize);
    return new SearchEngine(connections, indexes, new DocumentCodec(), engine, new AdapterMetrics(Map.of()));
  }

  private static List<String> lastSearchArgs(FakeValkey fake) {
    List<List<byte[]>> all = fake.searchArgs();
    List<String> out = new ArrayList<>();
    for (byte[] b : all.get(all.size() - 1)) out.add(new String(b, UTF_8));
    return out;
  }

  @Test
  void requiresTextOrVector() {
    assertThatThrownBy(() -> search.search("docs", null, null, 5, false).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(MissingQueryParameterException.class);
  }

  @Test
  void missingCollectionYieldsEmpty() throws Exception {
    assertThat(search.search("nope", "anything", null, 5, false).get(5, TimeUnit.SECONDS)).isEmpty();
    assertThat(fake.searchCalls()).isZero();
  }

  @Test
  void nearestResultFirstInAscendingScoreOrder() throws Exception {
    List<ScoredResult> results = search.search("docs", "valkey vector search", null, 3, false).get(5, TimeUnit.SECONDS);

    assertThat(results).hasSize(3);
    assertThat(results.get(0).id()).isEqualTo(valkeyId.toString());
    assertThat(results.get(0).score()).isCloseTo(0.0, org.assertj.core.data.Offset.offset(1e-5));
    assertThat(results.get(0).payload()).containsEntry("text", "valkey vector search");
    assertThat(results).extracting(ScoredResult::score).isSorted();
    assertThat(results.get(0).vector()).isNull();
  }

  @Test
  void limitBoundsResults() throws Exception {
    assertThat(search.search("docs", "apple", null, 2, false).get(5, TimeUnit.SECONDS)).hasSize(2);
    assertThat(lastSearchArgs(fake)).containsSubsequence("LIMIT", "0", "2");
  }

  @Test
  void nullLimitUsesDocumentCount() throws Exception {
    assertThat(search.search("docs", "apple", null, null, false).get(5, TimeUnit.SECONDS)).hasSize(3);
    assertThat(lastSearchArgs(fake)).containsSubsequence("*=>[KNN 3 @vector $query_vector]", "LIMIT", "0", "3");
  }

  @Test
  void emptyCollectionOrZeroLimitSkipsQuery() throws Exception {
    assertThat(search.search("empty", "apple", null, null, false).get(5, TimeUnit.SECONDS)).isEmpty();
    assertThat(search.search("docs", "apple", null, 0, false).get(5, TimeUnit.SECONDS)).isEmpty();
    assertThat(fake.searchCalls()).isZero();
  }

  @Test
  void queryVectorTakesPrecedence() throws Exception {
    int before = embeddings.calls();
    float[] physics = embeddings.embed("quantum physics lecture");

    List<ScoredResult> results = search.search("docs", "apple banana cherry", physics, 1, false).get(5, TimeUnit.SECONDS);

    assertThat(results).singleElement().extracting(ScoredResult::id).isEqualTo(physicsId.toString());
    assertThat(embeddings.calls()).isEqualTo(before);
  }

  @Test
  void vectorsReturnedWhenRequested() throws Exception {
    List<ScoredResult> results = search.search("docs", "apple banana cherry", null, 1, true).get(5, TimeUnit.SECONDS);
    assertThat(results.get(0).vector()).hasSize(DIM);
  }

  @Test
  void batchSearchKeepsCloseMatchesPerQuery() throws Exception {
    int before = embeddings.calls();

    List<List<ScoredResult>> results = search
        .batchSearch("docs", List.of("apple banana cherry", "valkey vector search", "zebra"), 3, false, 0.1)
        .get(5, TimeUnit.SECONDS);

    assertThat(results).hasSize(3);
    assertThat(results.get(0)).extracting(ScoredResult::id).containsExactly(fruitId.toString());
    assertThat(results.get(1)).extracting(ScoredResult::id).containsExactly(valkeyId.toString());
    assertThat(results.get(2)).isEmpty();
    assertThat(embeddings.calls()).isEqualTo(before + 1);
  }

  @Test
  void batchSearchEdgeCases() throws Exception {
    assertThat(search.batchSearch("nope", List.of("a"), 3, false, 0.1).get(5, TimeUnit.SECONDS)).isEmpty();
    assertThat(search.batchSearch("docs", List.of(), 3, false, 0.1).get(5, TimeUnit.SECONDS)).isEmpty();
  }

  @Test
  void batchSearchRejectsVectorCountMismatch() {
    EmbeddingEngine dropsOne = new EmbeddingEngine() {
      @Override
      public CompletableFuture<List<float[]>> embedText(List<String> texts) {
        return CompletableFuture.completedFuture(List.of(embeddings.embed(texts.get(0))));
      }

      @Override
      public int getVectorSize() {
        return DIM;
      }
    };
    SearchEngine engine = engineFor(fake.config(), dropsOne);

    assertThatThrownBy(() -> engine
            .batchSearch("docs", List.of("apple", "valkey"), 5, false, 0.5)
            .get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 vectors for 2 texts");
    assertThat(fake.searchCalls()).isZero();
  }

  @Test
  void unscoredResultsSortLastAndAreDroppedFromBatches() throws Exception {
    UnifiedJedis client = mock(UnifiedJedis.class);
    when(client.ftInfo(anyString())).thenReturn(Map.<String, Object>of("num_docs", "2"));
    when(client.sendCommand(any(ProtocolCommand.class), any(byte[][].class)))
        .thenReturn(List.of(
            2L,
            "vdb:docs:a".getBytes(UTF_8), List.of("id".getBytes(UTF_8), "a".getBytes(UTF_8)),
            "vdb:docs:b".getBytes(UTF_8),
            List.of("id".getBytes(UTF_8), "b".getBytes(UTF_8), "score".getBytes(UTF_8), "0.05".getBytes(UTF_8))));
    SearchEngine engine = engineFor(ValkeyAdapterConfig.builder()
        .reconnectPolicy(ReconnectPolicy.none())
        .executor(Runnable::run)
        .clientFactory((url, cfg) -> client)
        .build());

    List<ScoredResult> single = engine.search("docs", "q", null, 2, false).get(5, TimeUnit.SECONDS);
    assertThat(single).extracting(ScoredResult::id).containsExactly("b", "a");
    assertThat(single.get(1).score()).isNull();

    List<List<ScoredResult>> batch = engine.batchSearch("docs", List.of("q"), 2, false, 0.1).get(5, TimeUnit.SECONDS);
    assertThat(batch).hasSize(1);
    assertThat(batch.get(0)).extracting(ScoredResult::id).containsExactly("b");
  }

  @Test
  void searchFailurePropagates() {
    UnifiedJedis client = mock(UnifiedJedis.class);
    when(client.ftInfo(anyString())).thenReturn(Map.<String, Object>of("num_docs", "1"));
    when(client.sendCommand(any(ProtocolCommand.class), any(byte[][].class)))
        .thenThrow(new JedisDataException("Syntax error at offset 1"));
    SearchEngine engine = engineFor(ValkeyAdapterConfig.builder()
        .reconnectPolicy(ReconnectPolicy.none())
        .executor(Runnable::run)
        .clientFactory((url, cfg) -> client)
        .build());

    assertThatThrownBy(() -> engine.search("docs", "q", null, 1, false).get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(JedisDataException.class);
  }
}
