package io.github.panghy.valkeyvector.schema;

import java.util.Map;

/**
 * Outcome of looking up an index's metadata, keeping a benign "not found" apart from a failure.
 *
 * @param status what the lookup found
 * @param info   index metadata, only for {@link Status#FOUND}
 * @param error  the failure, only for {@link Status#ERROR}
 */
public record IndexLookup(Status status, Map<String, Object> info, Throwable error) {

  public enum Status {
    FOUND,
    NOT_FOUND,
    ERROR
  }

  public static IndexLookup found(Map<String, Object> info) {
    return new IndexLookup(Status.FOUND, info == null ? Map.of() : info, null);
  }

  public static IndexLookup notFound() {
    return new IndexLookup(Status.NOT_FOUND, Map.of(), null);
  }

  public static IndexLookup error(Throwable error) {
    return new IndexLookup(Status.ERROR, Map.of(), error);
  }

  public boolean exists() {
    return status == Status.FOUND;
  }
}
