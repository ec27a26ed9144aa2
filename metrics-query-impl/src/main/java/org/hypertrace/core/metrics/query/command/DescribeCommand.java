package org.hypertrace.core.metrics.query.command;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.ToString;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetadataContext;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.predicate.Predicates;
import org.hypertrace.core.metrics.query.api.timeseries.TagSet;
import org.hypertrace.core.metrics.query.api.util.NaturalOrderComparator;

/**
 * Describes the tags of one metric. The body maps each tag key to the naturally sorted values it
 * takes across all tag sets that satisfy the predicate and the context's additional constraints.
 */
@AllArgsConstructor
@ToString
public class DescribeCommand implements Command {

  private final String metricName;
  private final Predicate predicate;

  @Override
  public String getName() {
    return "describe";
  }

  @Override
  public Result execute(ExecutionContext context) {
    List<TagSet> tagSets =
        context
            .getMetricMetadataApi()
            .getAllTags(metricName, new MetadataContext(context.getProfiler().orElse(null)));

    Predicate combined =
        Predicates.all(predicate, context.getAdditionalConstraints().orElse(null));
    Map<String, Set<String>> valuesByKey = new HashMap<>();
    for (TagSet tagSet : tagSets) {
      if (!combined.apply(tagSet)) {
        continue;
      }
      for (Map.Entry<String, String> tag : tagSet.entrySet()) {
        valuesByKey.computeIfAbsent(tag.getKey(), key -> new HashSet<>()).add(tag.getValue());
      }
    }

    Map<String, List<String>> body = new TreeMap<>();
    valuesByKey.forEach(
        (key, values) -> {
          List<String> sorted = new ArrayList<>(values);
          NaturalOrderComparator.sort(sorted);
          body.put(key, sorted);
        });
    return Result.of(body);
  }
}
