package org.hypertrace.core.metrics.query.api.profile;

import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects named timing spans for a single request. Spans may be recorded from any thread; they
 * are kept in the order they finish.
 *
 * <pre>{@code
 * try (Profiler.Span ignored = profiler.record("fetch")) {
 *   ...
 * }
 * }</pre>
 */
public class Profiler {

  private final Clock clock;
  private final List<Profile> profiles = new ArrayList<>();

  public Profiler() {
    this(Clock.systemUTC());
  }

  public Profiler(Clock clock) {
    this.clock = clock;
  }

  /** Starts a span that is recorded when closed. Closing more than once has no further effect. */
  public Span record(String name) {
    return new Span(name, clock.millis());
  }

  /** @return a snapshot of every span finished so far */
  public List<Profile> getAll() {
    synchronized (profiles) {
      return ImmutableList.copyOf(profiles);
    }
  }

  private void add(Profile profile) {
    synchronized (profiles) {
      profiles.add(profile);
    }
  }

  public final class Span implements AutoCloseable {
    private final String name;
    private final long startMillis;
    private boolean closed;

    private Span(String name, long startMillis) {
      this.name = name;
      this.startMillis = startMillis;
    }

    @Override
    public synchronized void close() {
      if (closed) {
        return;
      }
      closed = true;
      add(new Profile(name, startMillis, clock.millis()));
    }
  }
}
