package com.trade.arena.sim.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Structured outcome of a core operation. Local validation failures travel as
 * {@code fail(code, message)} instead of exceptions.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String message) {
        return new Result<>(false, null, message, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(Throwable t) {
        String msg = (t == null)
                ? "Unknown error"
                : (t.getMessage() == null ? t.toString() : t.getMessage());
        return new Result<>(false, null, msg, null);
    }

    // ---------- convenience helpers ----------

    @JsonIgnore
    public boolean isOk() {
        return success;
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }

    /**
     * Payload alias for {@link #getData()}.
     */
    public T get() {
        return data;
    }

    public T getOrElse(T fallback) {
        return (success && data != null) ? data : fallback;
    }

    public T orElseGet(Supplier<? extends T> supplier) {
        return (success && data != null) ? data : supplier.get();
    }

    public void ifSuccess(Consumer<? super T> consumer) {
        if (success) consumer.accept(data);
    }

    public void ifFailure(Consumer<? super String> consumer) {
        if (isFailure()) consumer.accept(error);
    }

    /**
     * Maps the payload when OK; propagates failure (code and message) otherwise.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (isFailure()) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (isFailure()) return Result.fail(errorCode, error);
        return Objects.requireNonNull(mapper.apply(data));
    }

    /**
     * Re-types a failed result so it can be returned from a method with a different payload.
     */
    public <R> Result<R> asFailure() {
        if (success) throw new IllegalStateException("Result is not a failure");
        return Result.fail(errorCode, error);
    }

    // ---------- static utilities ----------

    public static boolean isOk(Result<?> r) {
        return r != null && r.isSuccess();
    }

    public static String errorOf(Result<?> r) {
        return (r == null) ? "Result is null" : r.getError();
    }
}
