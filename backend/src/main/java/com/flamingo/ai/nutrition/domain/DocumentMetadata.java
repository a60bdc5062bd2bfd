package com.flamingo.ai.nutrition.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;

/**
 * Metadata attached to a {@link Document}. The fields read by the retrieval core are typed; any
 * other key the ingestion layer stored is kept in {@code extra}.
 *
 * <p>All typed fields are optional and may be {@code null}.
 */
@Builder(toBuilder = true)
public record DocumentMetadata(
    String source,
    String url,
    String name,
    String type,
    String date,
    String createdAt,
    Map<String, Object> extra) {

  public static final String SOURCE = "source";
  public static final String URL = "url";
  public static final String NAME = "name";
  public static final String TYPE = "type";
  public static final String DATE = "date";
  public static final String CREATED_AT = "created_at";

  private static final DocumentMetadata EMPTY =
      new DocumentMetadata(null, null, null, null, null, null, Map.of());

  public DocumentMetadata {
    extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public static DocumentMetadata empty() {
    return EMPTY;
  }

  /**
   * Reads a loosely typed metadata map. Known keys become typed fields (non-string values are
   * converted with {@code toString()}), every other entry is kept as-is in {@code extra}.
   */
  public static DocumentMetadata from(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }
    Map<String, Object> extra = new LinkedHashMap<>();
    DocumentMetadataBuilder builder = builder();
    values.forEach(
        (key, value) -> {
          switch (key) {
            case SOURCE -> builder.source(asString(value));
            case URL -> builder.url(asString(value));
            case NAME -> builder.name(asString(value));
            case TYPE -> builder.type(asString(value));
            case DATE -> builder.date(asString(value));
            case CREATED_AT -> builder.createdAt(asString(value));
            default -> extra.put(key, value);
          }
        });
    return builder.extra(extra).build();
  }

  /** Returns the metadata as a loose map using the ingestion layer's key names. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    putIfPresent(map, SOURCE, source);
    putIfPresent(map, URL, url);
    putIfPresent(map, NAME, name);
    putIfPresent(map, TYPE, type);
    putIfPresent(map, DATE, date);
    putIfPresent(map, CREATED_AT, createdAt);
    map.putAll(extra);
    return map;
  }

  public Optional<String> sourceValue() {
    return Optional.ofNullable(source);
  }

  public Optional<String> urlValue() {
    return Optional.ofNullable(url);
  }

  public Optional<String> nameValue() {
    return Optional.ofNullable(name);
  }

  public Optional<String> typeValue() {
    return Optional.ofNullable(type);
  }

  /** The document date: {@code date} when set, otherwise {@code created_at}. */
  public Optional<String> dateOrCreatedAt() {
    if (date != null && !date.isEmpty()) {
      return Optional.of(date);
    }
    return Optional.ofNullable(createdAt).filter(value -> !value.isEmpty());
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static void putIfPresent(Map<String, Object> map, String key, String value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
