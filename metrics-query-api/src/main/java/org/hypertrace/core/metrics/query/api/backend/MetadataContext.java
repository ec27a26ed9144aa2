package org.hypertrace.core.metrics.query.api.backend;

import java.util.Optional;
import lombok.AllArgsConstructor;
import org.hypertrace.core.metrics.query.api.profile.Profiler;

/** Per-call context handed to the metadata backend so cache misses show up in the profile. */
@AllArgsConstructor
public class MetadataContext {
  private final Profiler profiler;

  public Optional<Profiler> getProfiler() {
    return Optional.ofNullable(profiler);
  }
}
