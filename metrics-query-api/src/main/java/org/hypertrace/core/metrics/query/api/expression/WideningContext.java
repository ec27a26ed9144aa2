package org.hypertrace.core.metrics.query.api.expression;

import java.time.Duration;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects the lookback every expression of a query needs. All views derived through {@link
 * #shiftedBy(Duration)} share the same earliest start, which only ever moves back in time.
 */
public class WideningContext {

  private final long currentStart;
  private final long resolution;
  private final FunctionRegistry registry;
  private final EarliestStart earliest;

  public WideningContext(long start, long resolution, FunctionRegistry registry) {
    this(start, resolution, registry, new EarliestStart(start));
  }

  private WideningContext(
      long currentStart, long resolution, FunctionRegistry registry, EarliestStart earliest) {
    this.currentStart = currentStart;
    this.resolution = resolution;
    this.registry = registry;
    this.earliest = earliest;
  }

  /** @return the start the expression being asked is evaluated from, in epoch milliseconds */
  public long getCurrentStart() {
    return currentStart;
  }

  public long getResolution() {
    return resolution;
  }

  public FunctionRegistry getRegistry() {
    return registry;
  }

  public long getEarliest() {
    return earliest.get();
  }

  /** Lowers the earliest start to {@code start}. Later starts are ignored. */
  public void requestStart(long start) {
    earliest.lowerTo(start);
  }

  public void requestLookback(Duration lookback) {
    requestStart(currentStart - lookback.toMillis());
  }

  /**
   * A view for the children of a windowed expression: their evaluation starts {@code lookback}
   * earlier, and anything they request lands in this context's earliest start.
   */
  public WideningContext shiftedBy(Duration lookback) {
    WideningContext shifted =
        new WideningContext(currentStart - lookback.toMillis(), resolution, registry, earliest);
    shifted.requestStart(shifted.currentStart);
    return shifted;
  }

  private static final class EarliestStart {
    private final Lock lock = new ReentrantLock();
    private long value;

    private EarliestStart(long value) {
      this.value = value;
    }

    long get() {
      lock.lock();
      try {
        return value;
      } finally {
        lock.unlock();
      }
    }

    void lowerTo(long candidate) {
      lock.lock();
      try {
        if (candidate < value) {
          value = candidate;
        }
      } finally {
        lock.unlock();
      }
    }
  }
}
