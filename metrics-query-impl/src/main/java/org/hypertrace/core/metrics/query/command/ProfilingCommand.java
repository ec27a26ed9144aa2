package org.hypertrace.core.metrics.query.command;

import java.util.List;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.profile.Profile;
import org.hypertrace.core.metrics.query.api.profile.Profiler;

/**
 * Times another command and attaches every span recorded while it ran to the result metadata
 * under {@value #PROFILE_KEY}. The wrapped command sees the profiler in its context so it can
 * record spans of its own. Failures propagate untouched, without a profile.
 */
public class ProfilingCommand implements Command {

  public static final String PROFILE_KEY = "profile";

  private final Command command;
  private final Profiler profiler;

  public ProfilingCommand(Command command, Profiler profiler) {
    this.command = command;
    this.profiler = profiler;
  }

  @Override
  public String getName() {
    return command.getName();
  }

  @Override
  public Result execute(ExecutionContext context) {
    Result result;
    try (Profiler.Span ignored = profiler.record(getName() + ".execute")) {
      result = command.execute(context.withProfiler(profiler));
    }
    List<Profile> profiles = profiler.getAll();
    if (profiles.isEmpty()) {
      return result;
    }
    return result.withMetadata(PROFILE_KEY, profiles);
  }
}
