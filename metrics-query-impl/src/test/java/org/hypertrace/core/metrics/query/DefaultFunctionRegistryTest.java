package org.hypertrace.core.metrics.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.Set;
import org.hypertrace.core.metrics.query.api.expression.MetricFunction;
import org.junit.jupiter.api.Test;

class DefaultFunctionRegistryTest {

  @Test
  void looksUpFunctionsByName() {
    MetricFunction rate = function("rate");
    MetricFunction sum = function("sum");

    DefaultFunctionRegistry registry = new DefaultFunctionRegistry(Set.of(rate, sum));

    assertEquals(Optional.of(rate), registry.getFunction("rate"));
    assertEquals(Optional.empty(), registry.getFunction("avg"));
    assertEquals(Set.of("rate", "sum"), registry.getFunctionNames());
  }

  @Test
  void rejectsDuplicateNames() {
    Set<MetricFunction> functions = Set.of(function("rate"), function("rate"));

    assertThrows(IllegalArgumentException.class, () -> new DefaultFunctionRegistry(functions));
  }

  private static MetricFunction function(String name) {
    MetricFunction function = mock(MetricFunction.class);
    when(function.getName()).thenReturn(name);
    return function;
  }
}
