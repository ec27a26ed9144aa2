package org.hypertrace.core.metrics.query.command;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.timeseries.SampleMethod;

/** The time window of a select as written by the user, in epoch milliseconds. */
@Value
@Builder(toBuilder = true)
public class SelectContext {
  long start;
  long end;
  long resolution;

  /** Used when up or down sampling to match the chosen resolution. */
  @NonNull @Builder.Default SampleMethod sampleMethod = SampleMethod.MEAN;
}
