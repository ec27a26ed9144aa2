package org.hypertrace.core.metrics.query.api.exception;

/** An expression evaluated to something that is neither a series list nor a scalar set. */
public class TypeMismatchException extends QueryExecutionException {

  private final String query;

  public TypeMismatchException(String query) {
    super(String.format("query %s does not result in a timeseries or scalar.", query));
    this.query = query;
  }

  public String getQuery() {
    return query;
  }
}
