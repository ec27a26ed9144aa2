package org.hypertrace.core.metrics.query.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** JSON-encodable outcome of a {@link Command}: a body plus named metadata entries. */
@EqualsAndHashCode
@ToString
public final class Result {

  private final Object body;
  private final Map<String, Object> metadata;

  private Result(Object body, Map<String, Object> metadata) {
    this.body = body;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Result of(Object body) {
    return new Result(body, Map.of());
  }

  public static Result of(Object body, Map<String, Object> metadata) {
    return new Result(body, metadata);
  }

  public Object getBody() {
    return body;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /** @return a copy of this result with {@code key} set, replacing any previous entry */
  public Result withMetadata(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.put(key, value);
    return new Result(body, merged);
  }
}
