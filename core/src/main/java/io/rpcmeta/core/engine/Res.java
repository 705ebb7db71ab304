package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one sub-resolution: either a value or the matching failures that
 * prevented it. Failures collect and continue; schema errors are thrown instead
 * and never appear here.
 *
 * <p>
 * Immutable.
 *
 * @param <T> the value type
 */
public final class Res<T> {

    private final T value;
    private final List<Diagnostic> failures;

    private Res(T value, List<Diagnostic> failures) {
        this.value = value;
        this.failures = failures;
    }

    public static <T> Res<T> ok(T value) {
        return new Res<>(value, List.of());
    }

    public static <T> Res<T> fail(Diagnostic failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new Res<>(null, List.of(failure));
    }

    public static <T> Res<T> fail(List<Diagnostic> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("a failed result needs at least one diagnostic");
        }
        return new Res<>(null, List.copyOf(failures));
    }

    /**
     * Combines independent results. Succeeds with all values in order if every
     * result succeeded; otherwise fails with the failures of every failed
     * result, in order.
     */
    public static <T> Res<List<T>> all(List<Res<T>> results) {
        List<T> values = new ArrayList<>(results.size());
        List<Diagnostic> failures = new ArrayList<>();
        for (Res<T> result : results) {
            if (result.isOk()) {
                values.add(result.value);
            } else {
                failures.addAll(result.failures);
            }
        }
        return failures.isEmpty() ? ok(values) : fail(failures);
    }

    public boolean isOk() {
        return failures.isEmpty();
    }

    /**
     * @throws IllegalStateException if this result failed
     */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("no value in a failed result: " + failures);
        }
        return value;
    }

    /** Failures of this result; empty on success. */
    public List<Diagnostic> failures() {
        return failures;
    }

    public <U> Res<U> map(Function<? super T, ? extends U> f) {
        return isOk() ? ok(f.apply(value)) : new Res<>(null, failures);
    }

    public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
        return isOk() ? f.apply(value) : new Res<>(null, failures);
    }

    /**
     * Adds further failures, turning a success into a failure when {@code more}
     * is non-empty.
     */
    public Res<T> withFailures(List<Diagnostic> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<Diagnostic> merged = new ArrayList<>(failures);
        merged.addAll(more);
        return new Res<>(null, List.copyOf(merged));
    }

    @Override
    public String toString() {
        return isOk() ? "Res.ok[" + value + "]" : "Res.fail" + failures;
    }
}
