package io.github.panghy.valkeyvector.codec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reshapes raw {@code FT.SEARCH} replies into the {@code (count, {key -> {field -> value}})} pair
 * consumed by {@link DocumentCodec#decodeSearch(Object)}.
 *
 * <p>A RESP2 reply is flat: {@code [count, key1, [f1, v1, ...], key2, [...], ...]}. Keys and values
 * are left as they arrive (usually {@code byte[]}); the codec normalizes them to text. Replies that
 * already have the pair shape are returned as is, and anything unrecognized is passed through for
 * the codec to reject.</p>
 */
public final class SearchReplies {
  private SearchReplies() {}

  public static Object toPair(Object raw) {
    if (!(raw instanceof List<?> items) || items.isEmpty()) return raw;
    if (items.size() == 2 && items.get(1) instanceof Map) return raw;
    if (!(items.get(0) instanceof Number count)) return raw;
    Map<Object, Map<Object, Object>> docs = new LinkedHashMap<>();
    int i = 1;
    while (i < items.size()) {
      Object key = items.get(i++);
      Map<Object, Object> fields = new LinkedHashMap<>();
      if (i < items.size() && items.get(i) instanceof List<?> flat) {
        for (int j = 0; j + 1 < flat.size(); j += 2) fields.put(flat.get(j), flat.get(j + 1));
        i++;
      }
      docs.put(key, fields);
    }
    return List.of(count.longValue(), docs);
  }
}
