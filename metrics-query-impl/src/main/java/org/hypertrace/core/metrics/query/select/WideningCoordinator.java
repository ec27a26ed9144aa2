package org.hypertrace.core.metrics.query.select;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.api.exception.InvalidRangeException;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.expression.WideningContext;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

/**
 * Asks every expression of a select how much history it needs and widens the user's range to the
 * earliest start any of them requested. Expressions may be consulted in any order, and from any
 * thread, since only the minimum survives.
 */
@Slf4j
public class WideningCoordinator {

  /**
   * @return the range from the earliest requested start to the user's end, at the user's
   *     resolution, or the user's range unchanged if that widened range is not valid
   */
  public Timerange widen(
      Timerange userTimerange, List<Expression> expressions, FunctionRegistry registry) {
    WideningContext context =
        new WideningContext(userTimerange.getStart(), userTimerange.getResolution(), registry);
    for (Expression expression : expressions) {
      expression.widen(context);
    }

    long earliest = context.getEarliest();
    try {
      return Timerange.snap(earliest, userTimerange.getEnd(), userTimerange.getResolution());
    } catch (InvalidRangeException e) {
      log.warn(
          "Widened start {} does not form a valid range, falling back to {}",
          earliest,
          userTimerange,
          e);
      return userTimerange;
    }
  }
}
