package org.hypertrace.core.metrics.query.command;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.ToString;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetadataContext;

/** Lists every known metric whose name contains a match of the given pattern, sorted. */
@AllArgsConstructor
@ToString
public class DescribeAllCommand implements Command {

  static final String COUNT_KEY = "count";

  private final Pattern matcher;

  @Override
  public String getName() {
    return "describe all";
  }

  @Override
  public Result execute(ExecutionContext context) {
    List<String> metrics =
        context
            .getMetricMetadataApi()
            .getAllMetrics(new MetadataContext(context.getProfiler().orElse(null)));
    List<String> filtered =
        metrics.stream()
            .filter(metric -> matcher.matcher(metric).find())
            .sorted()
            .collect(Collectors.toUnmodifiableList());
    return Result.of(filtered, Map.of(COUNT_KEY, filtered.size()));
  }
}
