package org.hypertrace.core.metrics.query.api.backend;

import lombok.Builder;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.timeseries.SampleMethod;
import org.hypertrace.core.metrics.query.api.timeseries.TagSet;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

@Value
@Builder
public class FetchTimeseriesRequest {
  String metricName;
  TagSet tagSet;
  SampleMethod sampleMethod;
  Timerange timerange;
}
