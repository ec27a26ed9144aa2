package org.hypertrace.core.metrics.query.api.timeseries;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;

/** An immutable set of tag key/value pairs identifying one series. */
@EqualsAndHashCode
public final class TagSet {

  private static final TagSet EMPTY = new TagSet(ImmutableMap.of());

  private final ImmutableSortedMap<String, String> tags;

  private TagSet(Map<String, String> tags) {
    this.tags = ImmutableSortedMap.copyOf(tags);
  }

  public static TagSet of(Map<String, String> tags) {
    return tags.isEmpty() ? EMPTY : new TagSet(tags);
  }

  public static TagSet of(String key, String value) {
    return new TagSet(ImmutableMap.of(key, value));
  }

  public static TagSet empty() {
    return EMPTY;
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(tags.get(key));
  }

  public boolean hasKey(String key) {
    return tags.containsKey(key);
  }

  public Set<Map.Entry<String, String>> entrySet() {
    return tags.entrySet();
  }

  @JsonValue
  public Map<String, String> asMap() {
    return tags;
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  /** Stable, key-ordered form such as {@code app=web,host=a}. */
  @Override
  public String toString() {
    return tags.entrySet().stream()
        .map(entry -> entry.getKey() + "=" + entry.getValue())
        .collect(Collectors.joining(","));
  }
}
