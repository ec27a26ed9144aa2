package org.hypertrace.core.metrics.query.command;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.expression.EvaluationContext;
import org.hypertrace.core.metrics.query.api.expression.EvaluationNotes;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.FetchCounter;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.expression.Value;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.predicate.Predicates;
import org.hypertrace.core.metrics.query.api.profile.Profiler;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;
import org.hypertrace.core.metrics.query.select.ConcurrentEvaluator;
import org.hypertrace.core.metrics.query.select.NegotiatedTimerange;
import org.hypertrace.core.metrics.query.select.ResolutionNegotiator;
import org.hypertrace.core.metrics.query.select.ResultAssembler;
import org.hypertrace.core.metrics.query.select.WideningCoordinator;

/**
 * Evaluates expressions over the series matching a predicate.
 *
 * <p>The user's range is snapped, widened to cover the lookback of every expression, and handed
 * to storage to pick a resolution that keeps the response within the slot limit. The
 * expressions are then evaluated at that resolution over the user's range, bounded by the
 * context's timeout.
 */
@Slf4j
public class SelectCommand implements Command {

  private final Predicate predicate;
  private final List<Expression> expressions;
  private final SelectContext selectContext;

  private final WideningCoordinator wideningCoordinator;
  private final ResolutionNegotiator resolutionNegotiator;
  private final ResultAssembler resultAssembler;

  public SelectCommand(
      Predicate predicate, List<Expression> expressions, SelectContext selectContext) {
    this(
        predicate,
        expressions,
        selectContext,
        new WideningCoordinator(),
        new ResolutionNegotiator(),
        new ResultAssembler());
  }

  SelectCommand(
      Predicate predicate,
      List<Expression> expressions,
      SelectContext selectContext,
      WideningCoordinator wideningCoordinator,
      ResolutionNegotiator resolutionNegotiator,
      ResultAssembler resultAssembler) {
    this.predicate = predicate;
    this.expressions = List.copyOf(expressions);
    this.selectContext = selectContext;
    this.wideningCoordinator = wideningCoordinator;
    this.resolutionNegotiator = resolutionNegotiator;
    this.resultAssembler = resultAssembler;
  }

  @Override
  public String getName() {
    return "select";
  }

  @Override
  public Result execute(ExecutionContext context) {
    Timerange userTimerange =
        Timerange.snap(
            selectContext.getStart(), selectContext.getEnd(), selectContext.getResolution());
    FunctionRegistry registry = context.getRegistry().orElse(FunctionRegistry.EMPTY);
    // spans recorded without a profiler in the context go nowhere
    Profiler profiler = context.getProfiler().orElseGet(Profiler::new);

    NegotiatedTimerange negotiated;
    try (Profiler.Span ignored = profiler.record("select.negotiate")) {
      Timerange widenedTimerange = wideningCoordinator.widen(userTimerange, expressions, registry);
      negotiated =
          resolutionNegotiator.negotiate(
              userTimerange,
              widenedTimerange,
              context.getEffectiveSlotLimit(),
              context.getTimeseriesStorageApi());
    }

    EvaluationContext evaluationContext =
        EvaluationContext.builder()
            .timeseriesStorageApi(context.getTimeseriesStorageApi())
            .metricMetadataApi(context.getMetricMetadataApi())
            .fetchCounter(new FetchCounter(context.getFetchLimit()))
            .predicate(Predicates.all(predicate, context.getAdditionalConstraints().orElse(null)))
            .sampleMethod(selectContext.getSampleMethod())
            .timerange(negotiated.getTimerange())
            .registry(registry)
            .profiler(context.getProfiler().orElse(null))
            .notes(new EvaluationNotes())
            .cancellation(context.getCancellation())
            .build();

    ConcurrentEvaluator evaluator =
        context
            .getEvaluationExecutor()
            .map(ConcurrentEvaluator::new)
            .orElseGet(ConcurrentEvaluator::new);

    List<Value> values;
    try (Profiler.Span ignored = profiler.record("select.evaluate")) {
      values = evaluator.evaluate(evaluationContext, expressions, context.getTimeout());
    }
    log.debug(
        "Evaluated {} expressions over {} with {} fetches",
        expressions.size(),
        negotiated.getTimerange(),
        evaluationContext.getFetchCounter().getCount());

    return resultAssembler.assemble(
        expressions, values, negotiated, evaluationContext.getNotes());
  }
}
