package org.hypertrace.core.metrics.query.api.expression;

import java.util.concurrent.atomic.AtomicInteger;
import org.hypertrace.core.metrics.query.api.exception.LimitException;

/** Request-scoped ceiling on the number of series an expression tree may fetch. Thread-safe. */
public class FetchCounter {

  private final int limit;
  private final AtomicInteger count = new AtomicInteger();

  public FetchCounter(int limit) {
    this.limit = limit;
  }

  /**
   * Accounts for {@code fetches} upcoming fetches.
   *
   * @throws LimitException once the total crosses the limit
   */
  public void consume(int fetches) {
    int total = count.addAndGet(fetches);
    if (total > limit) {
      throw new LimitException("fetch limit exceeded: too many series to fetch", total, limit);
    }
  }

  public int getCount() {
    return count.get();
  }

  public int getLimit() {
    return limit;
  }
}
