package org.hypertrace.core.metrics.query.select;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.query.api.exception.LimitException;
import org.hypertrace.core.metrics.query.api.exception.QueryExecutionException;
import org.hypertrace.core.metrics.query.api.expression.EvaluationContext;
import org.hypertrace.core.metrics.query.api.expression.Expression;
import org.hypertrace.core.metrics.query.api.expression.Value;

/**
 * Evaluates the expressions of a select on a separate task and waits for it no longer than the
 * request allows.
 *
 * <p>The running task cannot be interrupted. When the caller stops waiting, because the timeout
 * elapsed or the request was cancelled, the task keeps running to completion and its result is
 * dropped. The task always hands its outcome to a {@link CompletableFuture}, which never blocks
 * it, whether or not anybody is still listening.
 */
@Slf4j
public class ConcurrentEvaluator {

  private static final ExecutorService DEFAULT_EXECUTOR = newExecutor();

  private final Executor executor;
  private final Scheduler timerScheduler;

  public ConcurrentEvaluator() {
    this(DEFAULT_EXECUTOR);
  }

  public ConcurrentEvaluator(Executor executor) {
    this(executor, Schedulers.computation());
  }

  public ConcurrentEvaluator(Executor executor, Scheduler timerScheduler) {
    this.executor = executor;
    this.timerScheduler = timerScheduler;
  }

  /** A cached pool of daemon threads, suited to tasks that may outlive their caller. */
  public static ExecutorService newExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("metrics-query-evaluation-%d")
            .build());
  }

  /**
   * Evaluates {@code expressions} in order and returns one value per expression.
   *
   * @param timeout how long to wait for the evaluation; zero waits until it completes or {@code
   *     context} is cancelled
   * @throws LimitException if the timeout elapsed, or the context was cancelled, first
   * @throws QueryExecutionException if the calling thread is interrupted while waiting; the
   *     interrupt flag stays set
   */
  public List<Value> evaluate(
      EvaluationContext context, List<Expression> expressions, Duration timeout) {
    try (CancellationScope scope =
        CancellationScope.derive(context.getCancellation(), timeout, timerScheduler)) {
      EvaluationContext scopedContext = context.withCancellation(scope.cancelled());

      CompletableFuture<List<Value>> pending =
          CompletableFuture.supplyAsync(() -> evaluateAll(scopedContext, expressions), executor);

      Single<List<Value>> evaluated =
          Single.fromCompletionStage(pending).onErrorResumeNext(error -> Single.error(unwrap(error)));
      Single<List<Value>> timedOut =
          scope.cancelled().andThen(Single.<List<Value>>error(() -> timeoutError(timeout)));

      try {
        return evaluated.ambWith(timedOut).blockingGet();
      } catch (RuntimeException e) {
        if (e.getCause() instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          log.warn("Interrupted while waiting for evaluation");
          throw new QueryExecutionException(
              "Interrupted while executing the query.", e.getCause());
        }
        throw e;
      }
    }
  }

  private static List<Value> evaluateAll(EvaluationContext context, List<Expression> expressions) {
    List<Value> values = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      values.add(expression.evaluate(context));
    }
    return Collections.unmodifiableList(values);
  }

  private static LimitException timeoutError(Duration timeout) {
    log.warn("Stopped waiting for evaluation after timeout of {}", timeout);
    return new LimitException("Timeout while executing the query.", timeout, timeout);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
