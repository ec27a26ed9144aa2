package org.hypertrace.core.metrics.query.command;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.ToString;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetadataContext;

/** Lists the metrics that use one exact tag key/value pair. */
@AllArgsConstructor
@ToString
public class DescribeMetricsCommand implements Command {

  static final String COUNT_KEY = "count";

  private final String tagKey;
  private final String tagValue;

  @Override
  public String getName() {
    return "describe metrics";
  }

  @Override
  public Result execute(ExecutionContext context) {
    List<String> metrics =
        context
            .getMetricMetadataApi()
            .getMetricsForTag(
                tagKey, tagValue, new MetadataContext(context.getProfiler().orElse(null)));
    return Result.of(metrics, Map.of(COUNT_KEY, metrics.size()));
  }
}
