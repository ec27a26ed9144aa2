package org.hypertrace.core.metrics.query.api.exception;

/**
 * Raised when a request crosses a configured bound: too many slots, too many fetches, or an
 * evaluation that outlived its timeout.
 */
public class LimitException extends QueryExecutionException {

  private final Object actual;
  private final Object limit;

  public LimitException(String message, Object actual, Object limit) {
    super(String.format("%s (actual: %s, limit: %s)", message, actual, limit));
    this.actual = actual;
    this.limit = limit;
  }

  /** @return the value that crossed the bound */
  public Object getActual() {
    return actual;
  }

  public Object getLimit() {
    return limit;
  }
}
