package org.hypertrace.core.metrics.query.select;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.exception.LimitException;
import org.hypertrace.core.metrics.query.api.timeseries.Timerange;

/**
 * Reconciles the resolution the user asked for with what storage can serve, under the slot
 * budget of the request.
 */
@Slf4j
public class ResolutionNegotiator {

  /**
   * @param userTimerange the snapped range the user asked for; the negotiated range keeps its
   *     endpoints
   * @param widenedTimerange the range that will actually be fetched, lookback included
   * @param slotLimit the maximum number of slots the negotiated range may hold
   * @throws LimitException if the negotiated range holds more than {@code slotLimit} slots
   */
  public NegotiatedTimerange negotiate(
      Timerange userTimerange,
      Timerange widenedTimerange,
      int slotLimit,
      TimeseriesStorageApi storageApi) {
    Duration smallestResolution = smallestResolution(widenedTimerange, slotLimit);
    Duration chosenResolution = storageApi.chooseResolution(widenedTimerange, smallestResolution);

    Timerange chosenTimerange =
        Timerange.snap(
            userTimerange.getStart(), userTimerange.getEnd(), chosenResolution.toMillis());
    if (chosenTimerange.getSlots() > slotLimit) {
      throw new LimitException(
          "Requested number of data points exceeds the configured limit",
          chosenTimerange.getSlots(),
          slotLimit);
    }

    log.debug(
        "Negotiated {} for requested {} (smallest acceptable resolution {}, chosen {})",
        chosenTimerange,
        userTimerange,
        smallestResolution,
        chosenResolution);
    return new NegotiatedTimerange(chosenTimerange, chosenResolution);
  }

  /**
   * The finest resolution at which the range stays within {@code slotLimit} slots with two slots
   * to spare: {@code duration / (slotLimit - 2)}, with the divisor never below one.
   */
  static Duration smallestResolution(Timerange timerange, int slotLimit) {
    return timerange.getDuration().dividedBy(Math.max(slotLimit - 2, 1));
  }
}
