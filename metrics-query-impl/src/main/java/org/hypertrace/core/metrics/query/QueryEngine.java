package org.hypertrace.core.metrics.query;

import io.reactivex.rxjava3.core.Completable;
import java.util.concurrent.ExecutorService;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.exception.QueryExecutionException;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.profile.Profiler;
import org.hypertrace.core.metrics.query.command.ProfilingCommand;

/**
 * Runs parsed commands against the configured backends and turns their outcome into a {@link
 * QueryResponse}. Every call gets its own {@link ExecutionContext}.
 */
@Singleton
@Slf4j
public class QueryEngine {

  static final String EVALUATION_EXECUTOR = "evaluationExecutor";

  private final QueryEngineConfig config;
  private final TimeseriesStorageApi timeseriesStorageApi;
  private final MetricMetadataApi metricMetadataApi;
  private final FunctionRegistry functionRegistry;
  private final ExecutorService evaluationExecutor;

  @Inject
  QueryEngine(
      QueryEngineConfig config,
      TimeseriesStorageApi timeseriesStorageApi,
      MetricMetadataApi metricMetadataApi,
      FunctionRegistry functionRegistry,
      @Named(EVALUATION_EXECUTOR) ExecutorService evaluationExecutor) {
    this.config = config;
    this.timeseriesStorageApi = timeseriesStorageApi;
    this.metricMetadataApi = metricMetadataApi;
    this.functionRegistry = functionRegistry;
    this.evaluationExecutor = evaluationExecutor;
  }

  public QueryResponse execute(Command command) {
    return execute(command, null, Completable.never());
  }

  /**
   * @param additionalConstraints optional predicate applied on top of the command's own
   * @param cancellation completes when the caller is no longer interested in the response
   */
  public QueryResponse execute(
      Command command, Predicate additionalConstraints, Completable cancellation) {
    ExecutionContext context =
        ExecutionContext.builder()
            .timeseriesStorageApi(timeseriesStorageApi)
            .metricMetadataApi(metricMetadataApi)
            .fetchLimit(config.getFetchLimit())
            .slotLimit(config.getSlotLimit())
            .timeout(config.getTimeout())
            .registry(functionRegistry)
            .additionalConstraints(additionalConstraints)
            .cancellation(cancellation)
            .evaluationExecutor(evaluationExecutor)
            .build();

    Command toExecute =
        config.isProfilingEnabled() ? new ProfilingCommand(command, new Profiler()) : command;
    try {
      Result result = toExecute.execute(context);
      return QueryResponse.success(command.getName(), result);
    } catch (QueryExecutionException e) {
      log.warn("Query failed: {}: {}", command, e.getMessage());
      return QueryResponse.failure(e.getMessage());
    } catch (RuntimeException e) {
      log.error("Query failed unexpectedly: {}", command, e);
      return QueryResponse.failure(e.getMessage());
    }
  }
}
