package org.hypertrace.core.metrics.query.select;

import java.time.Duration;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

@Value
public class NegotiatedTimerange {
  Timerange timerange;
  /** As chosen by storage, before snapping. */
  Duration resolution;
}
