package org.hypertrace.core.metrics.query.api.backend;

import java.util.List;
import org.hypertrace.core.metrics.query.api.exception.BackendException;
import org.hypertrace.core.metrics.query.api.timeseries.TagSet;

/**
 * Serves the tag sets known for each metric. Every method may fail with a {@link
 * BackendException}.
 */
public interface MetricMetadataApi {

  List<TagSet> getAllTags(String metricName, MetadataContext context);

  List<String> getAllMetrics(MetadataContext context);

  /** @return the metrics that carry exactly {@code tagKey=tagValue} on at least one series */
  List<String> getMetricsForTag(String tagKey, String tagValue, MetadataContext context);
}
