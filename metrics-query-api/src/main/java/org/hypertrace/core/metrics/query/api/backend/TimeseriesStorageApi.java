package org.hypertrace.core.metrics.query.api.backend;

import java.time.Duration;
import org.hypertrace.core.metrics.query.api.exception.BackendException;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;
import org.hypertrace.core.metrics.query.api.timeseries.Timeseries;

/** Serves raw samples and advises on the resolution they can be served at. */
public interface TimeseriesStorageApi {

  /**
   * Picks the resolution a query over {@code timerange} should run at. Storage is free to pick a
   * coarser resolution than asked for, for cost or availability reasons, but never a finer one.
   *
   * @param smallestResolution the finest resolution the caller can accept
   * @return a resolution no smaller than {@code smallestResolution}
   * @throws BackendException if no resolution can be served
   */
  Duration chooseResolution(Timerange timerange, Duration smallestResolution);

  /**
   * Fetches one series at the request's resolution. Callers must account for every fetch on the
   * request's fetch counter before calling.
   *
   * @throws BackendException on storage failure
   */
  Timeseries fetchSingleTimeseries(FetchTimeseriesRequest request);
}
