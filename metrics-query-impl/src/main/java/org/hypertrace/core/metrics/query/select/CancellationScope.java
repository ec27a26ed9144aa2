package org.hypertrace.core.metrics.query.select;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation signal derived from a parent signal and an optional timeout. Completes when
 * either fires. Closing the scope releases the timer and the subscription to the parent; it does
 * not complete the signal.
 */
final class CancellationScope implements AutoCloseable {

  private final CompletableSubject cancelled = CompletableSubject.create();
  private final CompositeDisposable resources = new CompositeDisposable();

  private CancellationScope() {}

  /** @param timeout zero for no timeout */
  static CancellationScope derive(Completable parent, Duration timeout, Scheduler scheduler) {
    CancellationScope scope = new CancellationScope();
    scope.resources.add(parent.subscribe(scope::cancel, error -> scope.cancel()));
    if (!timeout.isZero()) {
      scope.resources.add(
          Completable.timer(timeout.toMillis(), TimeUnit.MILLISECONDS, scheduler)
              .subscribe(scope::cancel));
    }
    return scope;
  }

  Completable cancelled() {
    return cancelled.hide();
  }

  private void cancel() {
    cancelled.onComplete();
  }

  @Override
  public void close() {
    resources.dispose();
  }
}
