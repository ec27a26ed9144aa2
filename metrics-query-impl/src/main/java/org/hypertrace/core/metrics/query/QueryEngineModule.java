package org.hypertrace.core.metrics.query;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import java.util.concurrent.ExecutorService;
import javax.inject.Named;
import javax.inject.Singleton;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.expression.MetricFunction;
import org.hypertrace.core.metrics.query.select.ConcurrentEvaluator;

class QueryEngineModule extends AbstractModule {

  private final QueryEngineConfig config;
  private final TimeseriesStorageApi timeseriesStorageApi;
  private final MetricMetadataApi metricMetadataApi;

  QueryEngineModule(
      QueryEngineConfig config,
      TimeseriesStorageApi timeseriesStorageApi,
      MetricMetadataApi metricMetadataApi) {
    this.config = config;
    this.timeseriesStorageApi = timeseriesStorageApi;
    this.metricMetadataApi = metricMetadataApi;
  }

  @Override
  protected void configure() {
    bind(QueryEngineConfig.class).toInstance(this.config);
    bind(TimeseriesStorageApi.class).toInstance(this.timeseriesStorageApi);
    bind(MetricMetadataApi.class).toInstance(this.metricMetadataApi);
    // function libraries contribute through their own modules
    Multibinder.newSetBinder(binder(), MetricFunction.class);
    bind(FunctionRegistry.class).to(DefaultFunctionRegistry.class);
  }

  @Provides
  @Singleton
  @Named(QueryEngine.EVALUATION_EXECUTOR)
  ExecutorService provideEvaluationExecutor() {
    return ConcurrentEvaluator.newExecutor();
  }
}
