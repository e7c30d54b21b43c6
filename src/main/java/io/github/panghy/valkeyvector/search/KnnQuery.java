package io.github.panghy.valkeyvector.search;

import io.github.panghy.valkeyvector.codec.DocumentCodec;
import io.github.panghy.valkeyvector.codec.VectorBytes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import redis.clients.jedis.util.SafeEncoder;

/**
 * A k-nearest-neighbor query against a collection index, rendered as {@code FT.SEARCH} arguments.
 *
 * <p>The query text is {@code *=>[KNN k @vector $query_vector]}; the vector travels as a packed
 * float32 parameter. Returned fields are {@code id}, {@code payload_data} and the similarity score
 * (aliased {@code score}), plus {@code vector} when requested.</p>
 *
 * @param indexName  index to query
 * @param k          number of neighbors, must be positive
 * @param vector     query vector
 * @param withVector whether to return the stored vector
 */
public record KnnQuery(String indexName, int k, float[] vector, boolean withVector) {

  public static final String VECTOR_PARAM = "query_vector";
  static final int DIALECT = 2;

  public KnnQuery {
    Objects.requireNonNull(indexName, "indexName must not be null");
    Objects.requireNonNull(vector, "vector must not be null");
    if (k <= 0) throw new IllegalArgumentException("k must be positive");
  }

  public String expression() {
    return "*=>[KNN " + k + " @vector $" + VECTOR_PARAM + "]";
  }

  /** Return clause as (path, alias) pairs. */
  List<String[]> returnFields() {
    List<String[]> fields = new ArrayList<>();
    fields.add(new String[] {"$." + DocumentCodec.FIELD_ID, DocumentCodec.FIELD_ID});
    fields.add(new String[] {"$." + DocumentCodec.FIELD_PAYLOAD, DocumentCodec.FIELD_PAYLOAD});
    fields.add(new String[] {DocumentCodec.FIELD_VECTOR_SCORE, DocumentCodec.FIELD_SCORE});
    if (withVector) fields.add(new String[] {"$." + DocumentCodec.FIELD_VECTOR, DocumentCodec.FIELD_VECTOR});
    return fields;
  }

  /** Arguments following the {@code FT.SEARCH} command name. */
  public byte[][] toArgs() {
    List<byte[]> args = new ArrayList<>();
    add(args, indexName);
    add(args, expression());
    add(args, "PARAMS");
    add(args, "2");
    add(args, VECTOR_PARAM);
    args.add(VectorBytes.toFloat32Bytes(vector));
    List<String[]> fields = returnFields();
    add(args, "RETURN");
    add(args, Integer.toString(fields.size() * 3));
    for (String[] f : fields) {
      add(args, f[0]);
      add(args, "AS");
      add(args, f[1]);
    }
    add(args, "LIMIT");
    add(args, "0");
    add(args, Integer.toString(k));
    add(args, "DIALECT");
    add(args, Integer.toString(DIALECT));
    return args.toArray(new byte[0][]);
  }

  private static void add(List<byte[]> args, String s) {
    args.add(SafeEncoder.encode(s));
  }
}
