package io.github.panghy.valkeyvector.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Prepares payload trees for JSON encoding: {@link UUID} leaves become strings, maps and
 * collections are copied recursively (map keys become strings), everything else is passed through.
 */
public final class PayloadSerializer {
  private PayloadSerializer() {}

  public static Object serialize(Object value) {
    if (value instanceof UUID) return value.toString();
    if (value instanceof Map<?, ?> map) return serializeMap(map);
    if (value instanceof Collection<?> items) {
      List<Object> out = new ArrayList<>(items.size());
      for (Object item : items) out.add(serialize(item));
      return out;
    }
    return value;
  }

  /** Copies a map with string keys and serialized values. */
  public static Map<String, Object> serializeMap(Map<?, ?> map) {
    Map<String, Object> out = new LinkedHashMap<>();
    map.forEach((k, v) -> out.put(String.valueOf(k), serialize(v)));
    return out;
  }
}
