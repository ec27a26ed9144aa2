package org.hypertrace.core.metrics.query.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.metrics.query.api.Command;
import org.hypertrace.core.metrics.query.api.ExecutionContext;
import org.hypertrace.core.metrics.query.api.Result;
import org.hypertrace.core.metrics.query.api.backend.MetricMetadataApi;
import org.hypertrace.core.metrics.query.api.backend.TimeseriesStorageApi;
import org.hypertrace.core.metrics.query.api.exception.BackendException;
import org.hypertrace.core.metrics.query.api.profile.Profile;
import org.hypertrace.core.metrics.query.api.profile.Profiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProfilingCommandTest {

  private Command command;
  private ExecutionContext context;

  @BeforeEach
  void setup() {
    command = mock(Command.class);
    when(command.getName()).thenReturn("describe");
    context =
        ExecutionContext.builder()
            .timeseriesStorageApi(mock(TimeseriesStorageApi.class))
            .metricMetadataApi(mock(MetricMetadataApi.class))
            .build();
  }

  @Test
  void attachesProfilesToResult() {
    when(command.execute(any()))
        .thenAnswer(
            invocation -> {
              ExecutionContext inner = invocation.getArgument(0);
              inner.getProfiler().orElseThrow().record("metadata.fetch").close();
              return Result.of(List.of("cpu"), Map.of("count", 1));
            });
    Profiler profiler = new Profiler();
    ProfilingCommand profiling = new ProfilingCommand(command, profiler);

    Result result = profiling.execute(context);

    assertEquals("describe", profiling.getName());
    assertEquals(List.of("cpu"), result.getBody());
    assertEquals(1, result.getMetadata().get("count"));
    List<Profile> profiles =
        ((List<?>) result.getMetadata().get(ProfilingCommand.PROFILE_KEY))
            .stream().map(Profile.class::cast).collect(Collectors.toList());
    assertEquals(2, profiles.size());
    assertEquals("metadata.fetch", profiles.get(0).getName());
    assertEquals("describe.execute", profiles.get(1).getName());
  }

  @Test
  void propagatesFailureUnchanged() {
    BackendException failure = new BackendException("metadata unavailable");
    when(command.execute(any())).thenThrow(failure);

    BackendException exception =
        assertThrows(
            BackendException.class,
            () -> new ProfilingCommand(command, new Profiler()).execute(context));

    assertSame(failure, exception);
  }
}
