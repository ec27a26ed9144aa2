package org.hypertrace.core.metrics.query.api.exception;

/**
 * Base of every error a command can fail with. All of them are terminal for the request that
 * raised them: no partial result is ever returned alongside one.
 */
public class QueryExecutionException extends RuntimeException {

  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
