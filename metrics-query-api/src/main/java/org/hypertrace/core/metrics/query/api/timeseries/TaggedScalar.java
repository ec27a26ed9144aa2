package org.hypertrace.core.metrics.query.api.timeseries;

import lombok.Value;

/** A single number identified by a tag set, e.g. the result of aggregating a series over time. */
@Value
public class TaggedScalar {
  TagSet tagSet;
  double value;
}
