package org.hypertrace.core.metrics.query;

import com.google.inject.Guice;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.typesafe.config.Config;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;

public class QueryEngineFactory {

  /**
   * @param config the application config; its {@code query} block falls back to reference.conf
   * @param functionModules modules binding {@link
   *     org.hypertrace.core.metrics.query.api.expression.MetricFunction}s into the registry
   */
  public static QueryEngine build(
      Config config,
      TimeseriesStorageApi timeseriesStorageApi,
      MetricMetadataApi metricMetadataApi,
      Module... functionModules) {
    return Guice.createInjector(
            new QueryEngineModule(
                QueryEngineConfig.from(config), timeseriesStorageApi, metricMetadataApi),
            Modules.combine(functionModules))
        .getInstance(QueryEngine.class);
  }
}
