package org.hypertrace.core.metrics.query.api.expression;

import io.reactivex.rxjava3.core.Completable;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.profile.Profiler;
import org.hypertrace.core.metrics.query.api.timeseries.SampleMethod;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

/**
 * Everything an expression tree needs while evaluating one select. Built once per evaluation and
 * discarded with its result; the fetch counter and notes are shared by the whole tree and are
 * safe to use from several threads.
 */
@Value
@Builder
public class EvaluationContext {
  @NonNull TimeseriesStorageApi timeseriesStorageApi;
  @NonNull MetricMetadataApi metricMetadataApi;
  @NonNull FetchCounter fetchCounter;
  @NonNull Predicate predicate;
  @NonNull SampleMethod sampleMethod;
  @NonNull Timerange timerange;
  @NonNull @Builder.Default FunctionRegistry registry = FunctionRegistry.EMPTY;
  Profiler profiler;
  @NonNull @Builder.Default EvaluationNotes notes = new EvaluationNotes();

  /** Completes once the caller stopped waiting for this evaluation. */
  @With @NonNull @Builder.Default Completable cancellation = Completable.never();

  public Optional<Profiler> getProfiler() {
    return Optional.ofNullable(profiler);
  }
}
