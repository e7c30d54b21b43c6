package io.github.panghy.valkeyvector.codec;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.panghy.valkeyvector.ProtocolException;
import io.github.panghy.valkeyvector.api.DataPoint;
import io.github.panghy.valkeyvector.api.ScoredResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between data points, stored JSON documents and scored search results.
 *
 * <p>This is the only place where replies from the store are normalized: keys and field values may
 * arrive as raw {@code byte[]} or as text, and are turned into text before any field is read.
 * Decoding is tolerant of malformed input:
 * <ul>
 *   <li>a missing {@code id} field falls back to the storage key</li>
 *   <li>a missing or unparsable score becomes {@code null}</li>
 *   <li>a payload that is JSON but not an object is wrapped as {@code {_payload: value}}</li>
 *   <li>a payload that is not JSON is kept as {@code {_payload_raw: string}}</li>
 * </ul>
 */
public final class DocumentCodec {

  public static final String FIELD_ID = "id";
  public static final String FIELD_VECTOR = "vector";
  public static final String FIELD_PAYLOAD = "payload_data";
  public static final String FIELD_SCORE = "score";
  public static final String FIELD_VECTOR_SCORE = "__vector_score";
  public static final String PAYLOAD_RAW = "_payload_raw";
  public static final String PAYLOAD_WRAPPED = "_payload";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public DocumentCodec() {
    this(defaultMapper());
  }

  public DocumentCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /** Returns the mapper used when none is supplied: Jackson with java.time support. */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper().registerModule(new JavaTimeModule());
  }

  // ============= Encoding =============

  /**
   * Builds the storage document for a point and its embedding.
   *
   * @throws IllegalArgumentException if the payload cannot be written as JSON
   */
  public StorageDocument encode(DataPoint point, float[] vector) {
    String id = point.getId().toString();
    Map<String, Object> payload = new LinkedHashMap<>();
    Map<String, Object> source = point.toPayload();
    if (source != null) payload.putAll(PayloadSerializer.serializeMap(source));
    payload.putIfAbsent(FIELD_ID, id);
    return new StorageDocument(id, vector, writeJson(payload));
  }

  /** Serializes a storage document to the JSON stored under its key. */
  public String toJson(StorageDocument document) {
    return writeJson(document);
  }

  private String writeJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }

  // ============= Decoding =============

  /**
   * Decodes a search reply of the form {@code (count, {key -> {field -> value}})}.
   *
   * <p>Never throws. Input that is not a list or array of at least two elements whose second
   * element is a map yields an empty list.</p>
   */
  public List<ScoredResult> decodeSearch(Object raw) {
    Object second;
    if (raw instanceof List<?> list && list.size() >= 2) {
      second = list.get(1);
    } else if (raw instanceof Object[] array && array.length >= 2) {
      second = array[1];
    } else {
      return List.of();
    }
    if (!(second instanceof Map<?, ?> mapping)) return List.of();

    List<ScoredResult> results = new ArrayList<>(mapping.size());
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      results.add(decodeEntry(entry.getKey(), entry.getValue()));
    }
    return results;
  }

  private ScoredResult decodeEntry(Object rawKey, Object rawFields) {
    Map<String, Object> fields = normalizeFields(rawFields);
    String key = text(rawKey);
    Object rawId = fields.get(FIELD_ID);
    Object rawScore = fields.containsKey(FIELD_SCORE) ? fields.get(FIELD_SCORE) : fields.get(FIELD_VECTOR_SCORE);
    return ScoredResult.builder()
        .id(rawId != null ? text(rawId) : key)
        .score(parseScore(rawScore))
        .payload(decodePayload(fields.get(FIELD_PAYLOAD)))
        .vector(fields.containsKey(FIELD_VECTOR) ? parseVector(fields.get(FIELD_VECTOR)) : null)
        .build();
  }

  private static Map<String, Object> normalizeFields(Object rawFields) {
    Map<String, Object> fields = new LinkedHashMap<>();
    if (rawFields instanceof Map<?, ?> map) {
      map.forEach((k, v) -> fields.put(text(k), v instanceof byte[] ? text(v) : v));
    }
    return fields;
  }

  /** Parses a {@code payload_data} value; {@code null} yields an empty payload. */
  public Map<String, Object> decodePayload(Object rawPayload) {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (rawPayload == null) return payload;
    String json = text(rawPayload);
    try {
      Object parsed = mapper.readValue(json, Object.class);
      if (parsed instanceof Map<?, ?> map) {
        map.forEach((k, v) -> payload.put(String.valueOf(k), v));
      } else {
        payload.put(PAYLOAD_WRAPPED, parsed);
      }
    } catch (JsonProcessingException e) {
      payload.put(PAYLOAD_RAW, json);
    }
    return payload;
  }

  private static Double parseScore(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.doubleValue();
    try {
      return Double.parseDouble(text(raw).trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private float[] parseVector(Object raw) {
    if (raw == null) return null;
    try {
      JsonNode node = mapper.readTree(text(raw));
      // JSONPath returns may wrap the array once more
      if (node.isArray() && node.size() > 0 && node.get(0).isArray()) node = node.get(0);
      if (!node.isArray()) return null;
      float[] out = new float[node.size()];
      for (int i = 0; i < out.length; i++) out[i] = node.get(i).floatValue();
      return out;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  /**
   * Decodes a {@code JSON.GET} reply for one key into the stored payload.
   *
   * <p>Returns empty when the key does not exist. When the document parses but its
   * {@code payload_data} does not, the document itself is returned as retrieved.</p>
   *
   * @throws ProtocolException if the reply is not a JSON document
   */
  public Optional<Map<String, Object>> decodeRetrieved(Object raw) {
    if (raw == null) return Optional.empty();
    JsonNode node;
    try {
      node = mapper.readTree(text(raw));
    } catch (JsonProcessingException e) {
      throw new ProtocolException("Malformed stored document: " + e.getOriginalMessage(), e);
    }
    if (node != null && node.isArray()) node = node.size() == 0 ? null : node.get(0);
    if (node == null || !node.isObject()) return Optional.empty();

    Map<String, Object> document = mapper.convertValue(node, MAP_TYPE);
    Object payloadData = document.get(FIELD_PAYLOAD);
    if (payloadData == null) return Optional.of(document);
    try {
      Object parsed = mapper.readValue(text(payloadData), Object.class);
      if (parsed instanceof Map<?, ?>) return Optional.of(mapper.convertValue(parsed, MAP_TYPE));
      Map<String, Object> wrapped = new LinkedHashMap<>();
      wrapped.put(PAYLOAD_WRAPPED, parsed);
      return Optional.of(wrapped);
    } catch (JsonProcessingException e) {
      return Optional.of(document);
    }
  }

  /** Turns a protocol value into text; {@code byte[]} is decoded as UTF-8. */
  public static String text(Object value) {
    if (value == null) return null;
    if (value instanceof byte[] bytes) return new String(bytes, UTF_8);
    if (value instanceof String s) return s;
    return String.valueOf(value);
  }
}
