package com.trade.arena.sim.jobs;

/**
 * Reply of a trigger. {@code executed=false} marks a successful no-op (outside the window,
 * already done).
 */
public record TaskOutcome<T>(String task, boolean executed, String message, T data) {

    static <T> TaskOutcome<T> ran(String task, T data) {
        return new TaskOutcome<>(task, true, null, data);
    }

    static <T> TaskOutcome<T> skipped(String task, String message) {
        return new TaskOutcome<>(task, false, message, null);
    }
}
