package org.hypertrace.core.metrics.query.api;

import io.reactivex.rxjava3.core.Completable;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.profile.Profiler;

/**
 * Request-scoped configuration supplied when invoking a {@link Command}. Owned by the caller and
 * read-only to commands; the only field a command may replace, on a copy, is the profiler.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionContext {

  public static final int DEFAULT_SLOT_LIMIT = 1000;

  @NonNull TimeseriesStorageApi timeseriesStorageApi;
  @NonNull MetricMetadataApi metricMetadataApi;

  /** Maximum number of series fetches a single select may issue. */
  int fetchLimit;

  /** Zero means the caller is trusted to bound the request. */
  @NonNull @Builder.Default Duration timeout = Duration.ZERO;

  FunctionRegistry registry;

  /** Maximum number of slots a select may return; non-positive selects the default. */
  int slotLimit;

  @With Profiler profiler;

  /** Applied on top of every describe and select predicate, e.g. for administrative limits. */
  Predicate additionalConstraints;

  /** Completes when the caller gives up on the request. */
  @NonNull @Builder.Default Completable cancellation = Completable.never();

  Executor evaluationExecutor;

  public Optional<FunctionRegistry> getRegistry() {
    return Optional.ofNullable(registry);
  }

  public Optional<Profiler> getProfiler() {
    return Optional.ofNullable(profiler);
  }

  public Optional<Predicate> getAdditionalConstraints() {
    return Optional.ofNullable(additionalConstraints);
  }

  public Optional<Executor> getEvaluationExecutor() {
    return Optional.ofNullable(evaluationExecutor);
  }

  public int getEffectiveSlotLimit() {
    return slotLimit > 0 ? slotLimit : DEFAULT_SLOT_LIMIT;
  }
}
