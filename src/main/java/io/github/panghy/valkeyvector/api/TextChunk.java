package io.github.panghy.valkeyvector.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Plain text data point: the text is both embedded and stored in the payload.
 *
 * @param id       identifier of the chunk
 * @param text     the text to embed
 * @param metadata optional extra payload entries (may be empty)
 */
public record TextChunk(UUID id, String text, Map<String, Object> metadata) implements DataPoint {

  public TextChunk {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(text, "text must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static TextChunk of(UUID id, String text) {
    return new TextChunk(id, text, Map.of());
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getEmbeddableText() {
    return text;
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", id);
    payload.put("text", text);
    payload.put("type", "TextChunk");
    if (!metadata.isEmpty()) payload.put("metadata", metadata);
    return payload;
  }
}
