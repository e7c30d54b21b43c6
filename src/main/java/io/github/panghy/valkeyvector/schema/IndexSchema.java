package io.github.panghy.valkeyvector.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import redis.clients.jedis.search.FTCreateParams;
import redis.clients.jedis.search.IndexDataType;
import redis.clients.jedis.search.schemafields.SchemaField;
import redis.clients.jedis.search.schemafields.TagField;
import redis.clients.jedis.search.schemafields.VectorField;
import redis.clients.jedis.search.schemafields.VectorField.VectorAlgorithm;

/**
 * Index definition of a collection: JSON documents under the collection's key prefix, a tag field
 * {@code id} and an HNSW vector field {@code vector} (float32, cosine distance).
 */
public final class IndexSchema {

  public static final String ID_FIELD = "id";
  public static final String VECTOR_FIELD = "vector";
  public static final String VECTOR_TYPE = "FLOAT32";
  public static final String DISTANCE_METRIC = "COSINE";

  private final String collection;
  private final int dimension;

  private IndexSchema(String collection, int dimension) {
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.collection = collection;
    this.dimension = dimension;
  }

  public static IndexSchema forCollection(String collection, int dimension) {
    return new IndexSchema(collection, dimension);
  }

  public String indexName() {
    return CollectionNames.indexName(collection);
  }

  public String keyPrefix() {
    return CollectionNames.keyPrefix(collection);
  }

  public int dimension() {
    return dimension;
  }

  /** Attributes of the HNSW vector field. */
  public Map<String, Object> vectorAttributes() {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("TYPE", VECTOR_TYPE);
    attrs.put("DIM", dimension);
    attrs.put("DISTANCE_METRIC", DISTANCE_METRIC);
    return attrs;
  }

  public List<SchemaField> fields() {
    return List.of(
        new TagField("$." + ID_FIELD).as(ID_FIELD),
        new VectorField("$." + VECTOR_FIELD, VectorAlgorithm.HNSW, vectorAttributes()).as(VECTOR_FIELD));
  }

  public FTCreateParams createParams() {
    return FTCreateParams.createParams().on(IndexDataType.JSON).prefix(keyPrefix());
  }
}
