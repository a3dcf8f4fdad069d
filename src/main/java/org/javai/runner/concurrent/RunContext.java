package org.javai.runner.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation and deadline scope passed to every blocking operation of the runner.
 *
 * <p>A context is either the root {@link #background()} scope, which never ends, or a child
 * derived with {@link #withCancel()} or {@link #withTimeout(Duration)}. A child ends when it
 * is cancelled, when its deadline passes, or when its parent ends, whichever happens first.
 * Once ended a context stays ended and reports why through {@link #status()}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RunContext exec = RunContext.background().withTimeout(Duration.ofMinutes(5));
 * exec.sleep(Duration.ofSeconds(1));   // throws if exec ends first
 * String output = process.waitFor(exec);
 * }</pre>
 */
public final class RunContext {

    /**
     * Why a context is no longer active.
     */
    public enum Status {
        ACTIVE,
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final Logger logger = LogManager.getLogger(RunContext.class);

    private static final long NO_DEADLINE = Long.MAX_VALUE;
    private static final RunContext BACKGROUND = new RunContext(null, NO_DEADLINE);

    private final RunContext parent;
    private final long deadlineNanos;
    private final CompletableFuture<Status> done = new CompletableFuture<>();
    // Listeners unregister themselves, so a long-lived parent only holds its live children.
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    private RunContext(RunContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
        done.thenRun(this::notifyListeners);
        if (parent != null && parent != BACKGROUND) {
            Runnable unlink = parent.onDone(() -> done.complete(parent.done.getNow(Status.CANCELLED)));
            done.thenRun(unlink);
        }
        if (deadlineNanos != NO_DEADLINE) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                done.complete(Status.DEADLINE_EXCEEDED);
            } else {
                done.completeOnTimeout(Status.DEADLINE_EXCEEDED, remaining, TimeUnit.NANOSECONDS);
            }
        }
    }

    /**
     * The root context. It has no deadline and cannot be cancelled.
     */
    public static RunContext background() {
        return BACKGROUND;
    }

    /**
     * Derives a child that can be cancelled independently of this context.
     */
    public RunContext withCancel() {
        return new RunContext(this, deadlineNanos);
    }

    /**
     * Derives a child that ends after {@code timeout}, or earlier if this context ends first.
     */
    public RunContext withTimeout(Duration timeout) {
        long requested = saturatedDeadline(timeout);
        return new RunContext(this, Math.min(requested, deadlineNanos));
    }

    /**
     * Ends this context and every context derived from it. The background context ignores this.
     */
    public void cancel() {
        if (this != BACKGROUND) {
            done.complete(Status.CANCELLED);
        }
    }

    public boolean isDone() {
        if (!done.isDone() && deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            done.complete(Status.DEADLINE_EXCEEDED);
        }
        return done.isDone();
    }

    public Status status() {
        return isDone() ? done.getNow(Status.ACTIVE) : Status.ACTIVE;
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    /**
     * Time left before the deadline, zero once it has passed, empty without a deadline.
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline()) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(left <= 0 ? Duration.ZERO : Duration.ofNanos(left));
    }

    /**
     * The failure describing why this context ended, or {@code null} while it is active.
     * A passed deadline maps to {@link RunnerError#TIMEOUT}, cancellation to
     * {@link RunnerError#CANCELLED}.
     */
    public RunnerException error() {
        return switch (status()) {
            case ACTIVE -> null;
            case CANCELLED -> new RunnerException(RunnerError.CANCELLED, "context canceled");
            case DEADLINE_EXCEEDED -> new RunnerException(RunnerError.TIMEOUT, "context deadline exceeded");
        };
    }

    public void throwIfDone() throws RunnerException {
        RunnerException error = error();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Sleeps for {@code duration} unless the context ends first, in which case the
     * context's error is thrown immediately.
     */
    public void sleep(Duration duration) throws RunnerException {
        throwIfDone();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            done.get(duration.toNanos(), TimeUnit.NANOSECONDS);
            throwIfDone();
        } catch (TimeoutException e) {
            throwIfDone();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunnerException(RunnerError.CANCELLED, "interrupted while sleeping", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("context future completed exceptionally", e);
        }
    }

    /**
     * Runs {@code action} once this context ends, immediately if it already has. Does
     * nothing for the background context.
     *
     * @return removes the registration; the action will not run after this is called
     */
    public Runnable onDone(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        if (this == BACKGROUND) {
            return () -> {};
        }
        Runnable listener = () -> action.run();
        listeners.add(listener);
        if (done.isDone() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    RunContext parent() {
        return parent;
    }

    int listenerCount() {
        return listeners.size();
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            // remove first so that each listener runs exactly once
            if (listeners.remove(listener)) {
                try {
                    listener.run();
                } catch (RuntimeException e) {
                    logger.warn("Context listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    private static long saturatedDeadline(Duration timeout) {
        long now = System.nanoTime();
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException e) {
            return NO_DEADLINE - 1;
        }
        long deadline = now + nanos;
        // overflow check for very long timeouts
        if (nanos > 0 && deadline < now) {
            return NO_DEADLINE - 1;
        }
        return deadline;
    }

    @Override
    public String toString() {
        return "RunContext[" + status() + remaining().map(r -> ", remaining=" + r).orElse("") + "]";
    }
}
