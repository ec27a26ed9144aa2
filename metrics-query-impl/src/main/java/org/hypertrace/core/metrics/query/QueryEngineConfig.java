package org.hypertrace.core.metrics.query;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class QueryEngineConfig {

  private static final String CONFIG_PATH_ROOT = "query";
  private static final String CONFIG_PATH_SLOT_LIMIT = "slotLimit";
  private static final String CONFIG_PATH_FETCH_LIMIT = "fetchLimit";
  private static final String CONFIG_PATH_TIMEOUT = "timeout";
  private static final String CONFIG_PATH_PROFILING_ENABLED = "profiling.enabled";

  int slotLimit;
  int fetchLimit;
  Duration timeout;
  boolean profilingEnabled;

  QueryEngineConfig(Config config) {
    Config resolved = config.resolve();
    this.slotLimit = resolved.getInt(CONFIG_PATH_SLOT_LIMIT);
    this.fetchLimit = resolved.getInt(CONFIG_PATH_FETCH_LIMIT);
    this.timeout = resolved.getDuration(CONFIG_PATH_TIMEOUT);
    this.profilingEnabled = resolved.getBoolean(CONFIG_PATH_PROFILING_ENABLED);
  }

  /** Reads the {@code query} block of an application config, defaults from reference.conf. */
  public static QueryEngineConfig from(Config appConfig) {
    return new QueryEngineConfig(
        appConfig.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH_ROOT));
  }
}
