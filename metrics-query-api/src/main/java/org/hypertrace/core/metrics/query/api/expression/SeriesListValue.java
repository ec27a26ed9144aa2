package org.hypertrace.core.metrics.query.api.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.hypertrace.core.metrics.query.api.timeseries.SeriesList;
import org.hypertrace.core.metrics.query.api.timeseries.TaggedScalar;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

public final class SeriesListValue implements Value {
  private final SeriesList seriesList;

  public SeriesListValue(SeriesList seriesList) {
    this.seriesList = Objects.requireNonNull(seriesList);
  }

  public SeriesList getSeriesList() {
    return seriesList;
  }

  @Override
  public Optional<SeriesList> toSeriesList(Timerange timerange) {
    return Optional.of(seriesList);
  }

  @Override
  public Optional<List<TaggedScalar>> toScalarSet() {
    return Optional.empty();
  }
}
