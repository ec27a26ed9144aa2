package org.hypertrace.core.metrics.query.api.exception;

/**
 * Failure reported by a storage or metadata backend. The engine never retries these; retry
 * policy, if any, belongs to the backend itself.
 */
public class BackendException extends QueryExecutionException {

  public BackendException(String message) {
    super(message);
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
