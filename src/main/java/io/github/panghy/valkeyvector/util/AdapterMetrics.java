package io.github.panghy.valkeyvector.util;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.Map;

/**
 * OpenTelemetry instruments for one adapter instance. Instruments are bound when the adapter is
 * constructed, so a global SDK must be installed before that to be observed.
 */
public final class AdapterMetrics {
  public static final String INSTRUMENTATION_NAME = "io.github.panghy.valkeyvector";
  static final AttributeKey<String> COLLECTION = AttributeKey.stringKey("collection");

  private final Attributes baseAttributes;
  private final DoubleHistogram queryDurationMs;
  private final LongCounter queryCount;
  private final LongCounter documentsInserted;
  private final LongCounter documentsDeleted;
  private final LongCounter indexesDropped;

  public AdapterMetrics(Map<String, String> attributes) {
    AttributesBuilder b = Attributes.builder();
    attributes.forEach(b::put);
    this.baseAttributes = b.build();
    Meter meter = GlobalOpenTelemetry.getMeter(INSTRUMENTATION_NAME);
    this.queryDurationMs = meter.histogramBuilder("valkeyvector.query.duration_ms")
        .setUnit("ms")
        .build();
    this.queryCount = meter.counterBuilder("valkeyvector.query.count").build();
    this.documentsInserted =
        meter.counterBuilder("valkeyvector.documents.inserted").build();
    this.documentsDeleted =
        meter.counterBuilder("valkeyvector.documents.deleted").build();
    this.indexesDropped = meter.counterBuilder("valkeyvector.indexes.dropped").build();
  }

  public void recordQuery(String collection, long startNanos) {
    Attributes attrs = withCollection(collection);
    queryCount.add(1, attrs);
    queryDurationMs.record((System.nanoTime() - startNanos) / 1_000_000.0, attrs);
  }

  public void recordInserted(String collection, long n) {
    if (n > 0) documentsInserted.add(n, withCollection(collection));
  }

  public void recordDeleted(String collection, long n) {
    if (n > 0) documentsDeleted.add(n, withCollection(collection));
  }

  public void recordIndexDropped() {
    indexesDropped.add(1, baseAttributes);
  }

  private Attributes withCollection(String collection) {
    return baseAttributes.toBuilder().put(COLLECTION, collection).build();
  }
}
