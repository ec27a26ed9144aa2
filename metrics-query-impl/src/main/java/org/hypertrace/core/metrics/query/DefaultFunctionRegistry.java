package org.hypertrace.core.metrics.query;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.metrics.query.api.expression.FunctionRegistry;
import org.hypertrace.core.metrics.query.api.expression.MetricFunction;

/** Registry of every {@link MetricFunction} bound through Guice. Names must be unique. */
@Singleton
public class DefaultFunctionRegistry implements FunctionRegistry {

  private final Map<String, MetricFunction> functions;

  @Inject
  DefaultFunctionRegistry(Set<MetricFunction> functions) {
    this.functions =
        functions.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    MetricFunction::getName,
                    Function.identity(),
                    (first, second) -> {
                      throw new IllegalArgumentException(
                          "More than one function registered with name: " + first.getName());
                    }));
  }

  @Override
  public Optional<MetricFunction> getFunction(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  @Override
  public Set<String> getFunctionNames() {
    return functions.keySet();
  }
}
