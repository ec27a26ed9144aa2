package org.hypertrace.core.metrics.query.api;

import org.hypertrace.core.metrics.query.api.exception.QueryExecutionException;

/**
 * A parsed query, ready to run. A command contains all the information needed to execute the
 * query against the backends supplied by the {@link ExecutionContext}.
 */
public interface Command {

  String getName();

  /**
   * Runs the command. Each call produces a fresh {@link Result} owned by the caller.
   *
   * @throws QueryExecutionException if the command fails; no partial result is produced
   */
  Result execute(ExecutionContext context);
}
