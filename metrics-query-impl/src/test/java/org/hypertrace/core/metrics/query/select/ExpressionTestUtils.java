package org.hypertrace.core.metrics.query.select;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.hypertrace.core.metrics.query.api.expression.EvaluationContext;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.SeriesListValue;
import org.hypertrace.core.metrics.query.api.expression.Value;
import org.hypertrace.core.metrics.query.api.expression.WideningContext;
import org.hypertrace.core.metrics.query.api.timeseries.SeriesList;
import org.hypertrace.core.metrics.query.api.timeseries.TagSet;
import org.hypertrace.core.metrics.query.api.timeseries.Timeseries;

public class ExpressionTestUtils {

  public static Expression constant(String query, Value value) {
    return new FixedExpression(query, value, Duration.ZERO);
  }

  /** An expression evaluating to one single-sample series per tag set. */
  public static Expression series(String query, TagSet... tagSets) {
    return constant(query, seriesValue(tagSets));
  }

  public static Expression withLookback(String query, Duration lookback) {
    return new FixedExpression(query, seriesValue(), lookback);
  }

  public static Value seriesValue(TagSet... tagSets) {
    return new SeriesListValue(
        SeriesList.of(
            Arrays.stream(tagSets)
                .map(tagSet -> new Timeseries(new double[] {1.0}, tagSet))
                .collect(Collectors.toList())));
  }

  private static class FixedExpression implements Expression {
    private final String query;
    private final Value value;
    private final Duration lookback;

    private FixedExpression(String query, Value value, Duration lookback) {
      this.query = query;
      this.value = value;
      this.lookback = lookback;
    }

    @Override
    public Value evaluate(EvaluationContext context) {
      return value;
    }

    @Override
    public String getQueryText() {
      return query;
    }

    @Override
    public void widen(WideningContext context) {
      context.requestLookback(lookback);
    }
  }
}
