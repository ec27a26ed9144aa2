package org.hypertrace.core.metrics.query.api.timeseries;

import java.util.List;
import lombok.Value;

@Value
public class SeriesList {
  List<Timeseries> series;

  public static SeriesList of(List<Timeseries> series) {
    return new SeriesList(List.copyOf(series));
  }
}
