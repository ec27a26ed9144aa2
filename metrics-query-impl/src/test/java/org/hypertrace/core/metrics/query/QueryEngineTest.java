package org.hypertrace.core.metrics.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import io.reactivex.rxjava3.core.Completable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.exception.LimitException;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.predicate.Predicate;
import org.hypertrace.core.metrics.query.api.predicate.Predicates;
import org.hypertrace.core.metrics.query.command.ProfilingCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryEngineTest {

  private TimeseriesStorageApi storageApi;
  private MetricMetadataApi metadataApi;
  private ExecutorService executor;
  private Command command;

  @BeforeEach
  void setup() {
    storageApi = mock(TimeseriesStorageApi.class);
    metadataApi = mock(MetricMetadataApi.class);
    executor = mock(ExecutorService.class);
    command = mock(Command.class);
    when(command.getName()).thenReturn("describe all");
  }

  @Test
  void buildsContextFromConfig() {
    AtomicReference<ExecutionContext> seen = new AtomicReference<>();
    when(command.execute(any()))
        .thenAnswer(
            invocation -> {
              seen.set(invocation.getArgument(0));
              return Result.of(List.of("cpu"));
            });
    Predicate constraints = Predicates.tagIn("tenant", "acme");
    Completable cancellation = Completable.never();

    QueryResponse response = engine(false).execute(command, constraints, cancellation);

    assertTrue(response.isSuccess());
    assertEquals("describe all", response.getName());
    assertEquals(Result.of(List.of("cpu")), response.getBody());
    ExecutionContext context = seen.get();
    assertEquals(500, context.getSlotLimit());
    assertEquals(2_000, context.getFetchLimit());
    assertEquals(Duration.ofSeconds(2), context.getTimeout());
    assertSame(constraints, context.getAdditionalConstraints().orElseThrow());
    assertSame(cancellation, context.getCancellation());
    assertSame(executor, context.getEvaluationExecutor().orElseThrow());
    assertSame(storageApi, context.getTimeseriesStorageApi());
    assertFalse(context.getProfiler().isPresent());
  }

  @Test
  void attachesProfileWhenEnabled() {
    when(command.execute(any())).thenReturn(Result.of(List.of()));

    QueryResponse response = engine(true).execute(command);

    assertTrue(response.isSuccess());
    assertTrue(response.getBody().getMetadata().containsKey(ProfilingCommand.PROFILE_KEY));
  }

  @Test
  void reportsQueryFailure() {
    when(command.execute(any()))
        .thenThrow(new LimitException("Timeout while executing the query.", "2s", "2s"));

    QueryResponse response = engine(false).execute(command);

    assertFalse(response.isSuccess());
    assertEquals(
        "Timeout while executing the query. (actual: 2s, limit: 2s)", response.getMessage());
    assertNull(response.getBody());
  }

  @Test
  void reportsUnexpectedFailure() {
    when(command.execute(any())).thenThrow(new IllegalStateException("broken"));

    QueryResponse response = engine(false).execute(command);

    assertFalse(response.isSuccess());
    assertEquals("broken", response.getMessage());
  }

  private QueryEngine engine(boolean profilingEnabled) {
    QueryEngineConfig config =
        QueryEngineConfig.from(
            ConfigFactory.parseMap(
                Map.of(
                    "query.slotLimit", 500,
                    "query.timeout", "2s",
                    "query.profiling.enabled", profilingEnabled)));
    return new QueryEngine(config, storageApi, metadataApi, FunctionRegistry.EMPTY, executor);
  }
}
