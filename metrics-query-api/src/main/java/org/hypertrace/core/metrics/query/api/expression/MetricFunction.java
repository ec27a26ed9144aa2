package org.hypertrace.core.metrics.query.api.expression;

import java.util.List;

/** A named function of the query language, looked up through a {@link FunctionRegistry}. */
public interface MetricFunction {

  String getName();

  Value evaluate(EvaluationContext context, List<Expression> arguments);

  /** Widens for every argument. Windowed functions override this to add their lookback. */
  default void widen(WideningContext context, List<Expression> arguments) {
    arguments.forEach(argument -> argument.widen(context));
  }
}
