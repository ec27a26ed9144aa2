package org.hypertrace.core.metrics.query.api.expression;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.metrics.query.api.timeseries.SeriesList;
import org.hypertrace.core.metrics.query.api.timeseries.TaggedScalar;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

/**
 * The outcome of evaluating an {@link Expression}. A query may only end in one of the two
 * terminal shapes, {@link SeriesListValue} or {@link ScalarSetValue}; intermediate values produced
 * inside a function library answer empty to both conversions.
 */
public interface Value {

  /** @return the value as a series list over {@code timerange}, or empty if it is not one */
  Optional<SeriesList> toSeriesList(Timerange timerange);

  /** @return the value as a set of tagged scalars, or empty if it is not one */
  Optional<List<TaggedScalar>> toScalarSet();
}
