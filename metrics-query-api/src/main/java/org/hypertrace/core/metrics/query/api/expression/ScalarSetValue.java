package org.hypertrace.core.metrics.query.api.expression;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.metrics.query.api.timeseries.SeriesList;
import org.hypertrace.core.metrics.query.api.timeseries.TaggedScalar;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

public final class ScalarSetValue implements Value {
  private final List<TaggedScalar> scalars;

  public ScalarSetValue(List<TaggedScalar> scalars) {
    this.scalars = List.copyOf(scalars);
  }

  public List<TaggedScalar> getScalars() {
    return scalars;
  }

  @Override
  public Optional<SeriesList> toSeriesList(Timerange timerange) {
    return Optional.empty();
  }

  @Override
  public Optional<List<TaggedScalar>> toScalarSet() {
    return Optional.of(scalars);
  }
}
