package io.github.panghy.valkeyvector.schema;

import java.util.Optional;

/**
 * Naming scheme for collections: index {@code index:{name}}, documents under {@code vdb:{name}:}.
 * All names are pure functions of the collection name.
 */
public final class CollectionNames {
  static final String INDEX_PREFIX = "index:";
  static final String KEY_NAMESPACE = "vdb:";

  private CollectionNames() {}

  public static String indexName(String collection) {
    return INDEX_PREFIX + collection;
  }

  public static String keyPrefix(String collection) {
    return KEY_NAMESPACE + collection + ":";
  }

  public static String key(String collection, String id) {
    return keyPrefix(collection) + id;
  }

  /** Returns the collection an index belongs to, or empty if the index is not named by this scheme. */
  public static Optional<String> collectionOf(String indexName) {
    if (indexName == null || !indexName.startsWith(INDEX_PREFIX) || indexName.length() == INDEX_PREFIX.length()) {
      return Optional.empty();
    }
    return Optional.of(indexName.substring(INDEX_PREFIX.length()));
  }

  /** Returns a SCAN pattern matching every document key of the collection, glob characters escaped. */
  public static String keyPattern(String collection) {
    StringBuilder sb = new StringBuilder();
    for (char c : keyPrefix(collection).toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') sb.append('\\');
      sb.append(c);
    }
    return sb.append('*').toString();
  }
}
