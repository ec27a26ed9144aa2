package org.hypertrace.core.metrics.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Encodes responses as indented JSON. Encoding never fails: if a response cannot be serialized
 * a fixed failure payload is returned instead, since the regular error path would need the very
 * encoding that just failed.
 */
@Slf4j
public class QueryResponseEncoder {

  static final String RESULT_ENCODING_FAILURE =
      "{\"success\":false, \"message\":\"failed to encode result message\"}";
  static final String ERROR_ENCODING_FAILURE =
      "{\"success\":false, \"message\":\"failed to encode error message\"}";

  private final ObjectMapper objectMapper;

  @Inject
  public QueryResponseEncoder() {
    this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
  }

  QueryResponseEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(QueryResponse response) {
    try {
      return objectMapper.writeValueAsString(response);
    } catch (JsonProcessingException e) {
      log.error("Failed to encode response: {}", response, e);
      return response.isSuccess() ? RESULT_ENCODING_FAILURE : ERROR_ENCODING_FAILURE;
    }
  }
}
