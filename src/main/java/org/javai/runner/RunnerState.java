package org.javai.runner;

/**
 * Lifecycle states of a {@link Runner}.
 *
 * <p>Allowed transitions:</p>
 * <ul>
 *   <li>UNINITIALIZED → INITIALIZING</li>
 *   <li>INITIALIZING → READY</li>
 *   <li>READY ⇄ RUNNING</li>
 *   <li>any non-terminal state → SHUTTING_DOWN → STOPPED</li>
 * </ul>
 * STOPPED is terminal.
 */
public enum RunnerState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }

    public boolean canTransitionTo(RunnerState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == SHUTTING_DOWN) {
            return this != SHUTTING_DOWN;
        }
        return switch (this) {
            case UNINITIALIZED -> next == INITIALIZING;
            case INITIALIZING -> next == READY;
            case READY -> next == RUNNING;
            case RUNNING -> next == READY;
            case SHUTTING_DOWN -> next == STOPPED;
            case STOPPED -> false;
        };
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public static RunnerState validate(RunnerState from, RunnerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException(String.format("Invalid runner state transition: %s → %s", from, to));
        }
        return to;
    }
}
