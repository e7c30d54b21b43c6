package io.github.panghy.valkeyvector.api;

import java.util.Map;
import java.util.UUID;

/**
 * A caller-supplied record that can be stored in a collection and found by similarity.
 *
 * <p>Each data point contributes three things to its stored document:
 * <ul>
 *   <li>an identifier, unique within a collection, that also forms the storage key</li>
 *   <li>the text that is embedded into the document's vector</li>
 *   <li>an arbitrary payload tree (maps, lists and scalars) returned with search results</li>
 * </ul>
 *
 * <p>Payload values of type {@link UUID} are stored as strings. The stored payload always carries
 * an {@code id} entry equal to {@code getId().toString()}.</p>
 */
public interface DataPoint {

  /** Returns the identifier of this point. */
  UUID getId();

  /** Returns the text that is embedded to produce this point's vector. */
  String getEmbeddableText();

  /**
   * Returns the payload to store alongside the vector. Implementations may return nested maps
   * and lists; the map should be safe to read concurrently.
   */
  Map<String, Object> toPayload();
}
