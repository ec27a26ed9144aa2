package org.hypertrace.core.metrics.query.api.exception;

/** Malformed start, end or resolution. */
public class InvalidRangeException extends QueryExecutionException {

  public InvalidRangeException(String message) {
    super(message);
  }
}
