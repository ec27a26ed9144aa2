package org.hypertrace.core.metrics.query.api.expression;

/**
 * A node of a parsed query. Besides evaluating to a {@link Value}, every expression can describe
 * itself: as query text, as a display name, and by declaring how much history it needs before
 * anything is fetched.
 */
public interface Expression {

  Value evaluate(EvaluationContext context);

  /** @return text that parses back to this expression */
  String getQueryText();

  /** @return a short human-readable label, the query text unless overridden */
  default String getDisplayName() {
    return getQueryText();
  }

  /**
   * Requests an earlier start on {@code context} if this expression, or any child, needs samples
   * from before the current start. Must only ever lower the requested start, and may be called
   * from any thread.
   */
  default void widen(WideningContext context) {}
}
