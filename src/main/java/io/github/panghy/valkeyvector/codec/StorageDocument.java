package io.github.panghy.valkeyvector.codec;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The JSON document stored for one data point under {@code vdb:{collection}:{id}}.
 *
 * @param id          stringified data point id
 * @param vector      embedding, length equal to the collection dimensionality
 * @param payloadData the serialized payload, itself encoded as a JSON string
 */
public record StorageDocument(
    @JsonProperty("id") String id,
    @JsonProperty("vector") float[] vector,
    @JsonProperty("payload_data") String payloadData) {}
