package org.hypertrace.core.metrics.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.Result;

/** What a client receives for one query: either the named result or an error message. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(Include.NON_NULL)
public class QueryResponse {
  boolean success;
  String name;
  String message;
  Result body;

  public static QueryResponse success(String name, Result body) {
    return new QueryResponse(true, name, null, body);
  }

  public static QueryResponse failure(String message) {
    return new QueryResponse(false, null, message, null);
  }
}
