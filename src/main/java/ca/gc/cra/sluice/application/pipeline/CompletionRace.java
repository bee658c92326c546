package ca.gc.cra.sluice.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * <strong>What:</strong> Waits for the first of several keyed futures, reporting which one finished and how.
 * <p><strong>Why:</strong> The execution manager must decide between "a stream proxy failed" and "a process exited"
 * with one blocking call and no fixed timeout.</p>
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>A failure watch triggers only when its future completes exceptionally; normal completion and cancellation
 *   are ignored.</li>
 *   <li>A completion watch triggers on any completion.</li>
 *   <li>Watches that are already done when {@link #await()} is called are resolved in registration order, failure
 *   watches first.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build and await on one thread; futures may complete on any thread.</p>
 *
 * @param <K> key type identifying each watched future
 * @since 0.1.0
 */
public final class CompletionRace<K> {
  /** How the winning watch finished. */
  public enum Kind {
    FAILED,
    COMPLETED
  }

  /**
   * Winning watch.
   *
   * @param key key of the winning future
   * @param kind whether it failed or completed
   * @param cause failure, unwrapped from {@link CompletionException}; {@code null} for normal completion
   * @param <K> key type
   */
  public record Outcome<K>(K key, Kind kind, Throwable cause) {
    public Outcome {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(kind, "kind");
    }
  }

  private record Watch<K>(K key, CompletableFuture<?> future) {}

  private final List<Watch<K>> failureWatches = new ArrayList<>();
  private final List<Watch<K>> completionWatches = new ArrayList<>();

  public CompletionRace<K> onFailure(K key, CompletableFuture<?> future) {
    failureWatches.add(new Watch<>(Objects.requireNonNull(key, "key"), Objects.requireNonNull(future, "future")));
    return this;
  }

  public CompletionRace<K> onCompletion(K key, CompletableFuture<?> future) {
    completionWatches.add(new Watch<>(Objects.requireNonNull(key, "key"), Objects.requireNonNull(future, "future")));
    return this;
  }

  /**
   * Blocks until a watch triggers.
   *
   * @return winning watch
   * @throws InterruptedException when the calling thread is interrupted while waiting
   * @throws IllegalStateException when no completion watch was registered
   */
  public Outcome<K> await() throws InterruptedException {
    if (completionWatches.isEmpty()) {
      throw new IllegalStateException("race needs at least one completion watch");
    }
    for (Watch<K> watch : failureWatches) {
      Throwable failure = failureOf(watch.future());
      if (failure != null) {
        return new Outcome<>(watch.key(), Kind.FAILED, failure);
      }
    }
    for (Watch<K> watch : completionWatches) {
      if (watch.future().isDone()) {
        return new Outcome<>(watch.key(), Kind.COMPLETED, failureOf(watch.future()));
      }
    }

    CompletableFuture<Outcome<K>> winner = new CompletableFuture<>();
    for (Watch<K> watch : failureWatches) {
      watch.future().whenComplete((ignored, ex) -> {
        Throwable cause = unwrap(ex);
        if (cause != null && !(cause instanceof CancellationException)) {
          winner.complete(new Outcome<>(watch.key(), Kind.FAILED, cause));
        }
      });
    }
    for (Watch<K> watch : completionWatches) {
      watch.future().whenComplete(
          (ignored, ex) -> winner.complete(new Outcome<>(watch.key(), Kind.COMPLETED, unwrap(ex))));
    }
    try {
      return winner.get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("race winner failed unexpectedly", ex.getCause());
    }
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    if (!future.isCompletedExceptionally() || future.isCancelled()) {
      return null;
    }
    try {
      future.join();
      return null;
    } catch (CompletionException ex) {
      return unwrap(ex);
    } catch (CancellationException ex) {
      return null;
    }
  }

  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
