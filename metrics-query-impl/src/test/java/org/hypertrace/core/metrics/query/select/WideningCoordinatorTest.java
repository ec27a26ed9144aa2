package org.hypertrace.core.metrics.query.select;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;
import org.hypertrace.core.metrics.query.api.expression.EvaluationContext;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.expression.Value;
import org.hypertrace.core.metrics.query.api.expression.WideningContext;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;
import org.junit.jupiter.api.Test;

class WideningCoordinatorTest {

  private static final Timerange USER_TIMERANGE = Timerange.snap(600_000, 900_000, 10_000);

  private final WideningCoordinator coordinator = new WideningCoordinator();

  @Test
  void keepsUserRangeWithoutLookback() {
    assertEquals(USER_TIMERANGE, coordinator.widen(USER_TIMERANGE, List.of(), FunctionRegistry.EMPTY));
    assertEquals(
        USER_TIMERANGE,
        coordinator.widen(
            USER_TIMERANGE,
            List.of(ExpressionTestUtils.series("cpu")),
            FunctionRegistry.EMPTY));
  }

  @Test
  void widensToLongestLookback() {
    List<Expression> expressions =
        List.of(
            ExpressionTestUtils.withLookback("rate(cpu[30s])", Duration.ofSeconds(30)),
            ExpressionTestUtils.withLookback("rate(cpu[1m])", Duration.ofMinutes(1)),
            ExpressionTestUtils.series("cpu"));

    Timerange widened = coordinator.widen(USER_TIMERANGE, expressions, FunctionRegistry.EMPTY);

    assertEquals(Timerange.snap(540_000, 900_000, 10_000), widened);
  }

  @Test
  void orderOfExpressionsDoesNotMatter() {
    Expression shortLookback = ExpressionTestUtils.withLookback("a", Duration.ofSeconds(30));
    Expression longLookback = ExpressionTestUtils.withLookback("b", Duration.ofMinutes(1));

    assertEquals(
        coordinator.widen(
            USER_TIMERANGE, List.of(shortLookback, longLookback), FunctionRegistry.EMPTY),
        coordinator.widen(
            USER_TIMERANGE, List.of(longLookback, shortLookback), FunctionRegistry.EMPTY));
  }

  @Test
  void fallsBackToUserRangeWhenWidenedRangeIsInvalid() {
    Expression unbounded =
        new Expression() {
          @Override
          public Value evaluate(EvaluationContext context) {
            throw new UnsupportedOperationException();
          }

          @Override
          public String getQueryText() {
            return "unbounded";
          }

          @Override
          public void widen(WideningContext context) {
            context.requestStart(Long.MIN_VALUE);
          }
        };

    assertEquals(
        USER_TIMERANGE,
        coordinator.widen(USER_TIMERANGE, List.of(unbounded), FunctionRegistry.EMPTY));
  }
}
