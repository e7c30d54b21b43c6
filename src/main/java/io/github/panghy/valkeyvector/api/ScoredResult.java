package io.github.panghy.valkeyvector.api;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * A stored document paired with its similarity score.
 *
 * <p>Score semantics: the collection uses cosine distance, so lower is more similar.
 *
 * @param id      document id, or the raw storage key when the document carries no id field
 * @param payload decoded payload; {@code {_payload_raw: <string>}} when the stored payload is not
 *                valid JSON, {@code {_payload: <value>}} when it is JSON but not an object
 * @param score   distance reported by the store, or {@code null} if absent or unparsable
 * @param vector  stored vector, only populated when the search asked for vectors
 */
@Builder
public record ScoredResult(String id, Map<String, Object> payload, Double score, float[] vector) {

  /** Compares the vector by content. */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ScoredResult that)) return false;
    return Objects.equals(id, that.id)
        && Objects.equals(payload, that.payload)
        && Objects.equals(score, that.score)
        && Arrays.equals(vector, that.vector);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(id, payload, score) + Arrays.hashCode(vector);
  }

  @Override
  public String toString() {
    return "ScoredResult[id=" + id + ", payload=" + payload + ", score=" + score
        + ", vector=" + Arrays.toString(vector) + "]";
  }
}
