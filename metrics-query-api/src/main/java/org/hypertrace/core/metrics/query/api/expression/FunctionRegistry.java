package org.hypertrace.core.metrics.query.api.expression;

import java.util.Optional;
import java.util.Set;

public interface FunctionRegistry {

  FunctionRegistry EMPTY =
      new FunctionRegistry() {
        @Override
        public Optional<MetricFunction> getFunction(String name) {
          return Optional.empty();
        }

        @Override
        public Set<String> getFunctionNames() {
          return Set.of();
        }
      };

  Optional<MetricFunction> getFunction(String name);

  Set<String> getFunctionNames();
}
