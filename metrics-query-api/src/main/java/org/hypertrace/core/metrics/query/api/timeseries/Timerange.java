package org.hypertrace.core.metrics.query.api.timeseries;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.hypertrace.core.metrics.query.api.exception.InvalidRangeException;

/**
 * A validated range of time with a resolution, all values in epoch milliseconds. The end is
 * always aligned to the grid of slots that starts at {@code start} and advances by {@code
 * resolution}, so a range always holds a whole number of slots.
 *
 * <p>Instances can only be obtained through {@link #snap(long, long, long)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Timerange {

  long start;
  long end;
  long resolution;

  /**
   * Builds a range from raw values, moving {@code end} back onto the slot grid anchored at {@code
   * start}. Snapping an already snapped range yields an equal range.
   *
   * @throws InvalidRangeException if the resolution is not positive, start is after end, or the
   *     range cannot be represented
   */
  public static Timerange snap(long start, long end, long resolution) {
    if (resolution <= 0) {
      throw new InvalidRangeException("Invalid resolution: " + resolution);
    }
    if (start > end) {
      throw new InvalidRangeException(
          String.format("Invalid timerange: start %d is after end %d", start, end));
    }
    try {
      long span = Math.subtractExact(end, start);
      long snappedEnd = Math.addExact(start, span / resolution * resolution);
      return new Timerange(start, snappedEnd, resolution);
    } catch (ArithmeticException e) {
      throw new InvalidRangeException(
          String.format("Invalid timerange: [%d, %d] overflows", start, end));
    }
  }

  @JsonIgnore
  public Duration getDuration() {
    return Duration.ofMillis(end - start);
  }

  /** @return the number of sample positions, both endpoints included */
  @JsonIgnore
  public long getSlots() {
    return (end - start) / resolution + 1;
  }
}
