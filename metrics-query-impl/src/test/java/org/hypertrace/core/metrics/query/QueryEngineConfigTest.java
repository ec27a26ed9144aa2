package org.hypertrace.core.metrics.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class QueryEngineConfigTest {

  @Test
  void readsApplicationConfigOverReferenceDefaults() {
    QueryEngineConfig config =
        QueryEngineConfig.from(ConfigFactory.parseResources("application.conf"));

    assertEquals(500, config.getSlotLimit());
    assertEquals(2_000, config.getFetchLimit());
    assertEquals(Duration.ofSeconds(2), config.getTimeout());
    assertTrue(config.isProfilingEnabled());
  }

  @Test
  void fallsBackToReferenceDefaults() {
    QueryEngineConfig config = QueryEngineConfig.from(ConfigFactory.empty());

    assertEquals(1_000, config.getSlotLimit());
    assertEquals(2_000, config.getFetchLimit());
    assertEquals(Duration.ofSeconds(10), config.getTimeout());
    assertFalse(config.isProfilingEnabled());
  }
}
