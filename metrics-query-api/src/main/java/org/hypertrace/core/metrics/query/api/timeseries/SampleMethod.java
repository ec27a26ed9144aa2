package org.hypertrace.core.metrics.query.api.timeseries;

/** How storage combines raw samples when up or down sampling to the requested resolution. */
public enum SampleMethod {
  MEAN,
  MIN,
  MAX,
  SUM
}
