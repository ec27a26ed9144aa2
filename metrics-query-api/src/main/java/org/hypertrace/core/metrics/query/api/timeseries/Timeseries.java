package org.hypertrace.core.metrics.query.api.timeseries;

import lombok.Value;

/** One series of samples, one value per slot of its timerange. */
@Value
public class Timeseries {
  double[] values;
  TagSet tagSet;

  public Timeseries(double[] values, TagSet tagSet) {
    this.values = values.clone();
    this.tagSet = tagSet;
  }

  /** @return a copy of the samples */
  public double[] getValues() {
    return values.clone();
  }
}
