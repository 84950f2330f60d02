package com.ajjpj.workerpool.api.other;

import java.util.Objects;
import java.util.concurrent.ExecutionException;


/**
 * The outcome of a computation: either a successful value (possibly {@code null}) or a failure.
 *
 * @author arno
 */
public abstract class ATry<T> {

    public static <T> ATry<T> success (T o) {
        return new ASuccess<> (o);
    }

    public static <T> ATry<T> failure (Throwable th) {
        return new AFailure<> (Objects.requireNonNull (th, "failure must not be null"));
    }

    private ATry () {
    }

    /**
     * Calls f with the value if this is a success, does nothing otherwise.
     */
    public abstract <E extends Throwable> void foreach (AStatement1<T,E> f) throws E;

    /**
     * Turns a failure into a success holding the failure, and a success into a failure.
     */
    public abstract ATry<Throwable> inverse ();

    public abstract <S, E extends Throwable> ATry<S> map (ATryFunction<T, S, E> f) throws E;

    public abstract boolean isSuccess ();

    public boolean isFailure () {
        return ! isSuccess ();
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public abstract T getValue ();

    /**
     * @throws IllegalStateException if this is a success
     */
    public abstract Throwable getFailure ();

    /**
     * Returns the value, or throws an {@link ExecutionException} wrapping the failure. This is the {@link java.util.concurrent.Future} way of
     *  reporting failures.
     */
    public abstract T getOrThrow () throws ExecutionException;

    public interface ATryFunction<P, R, E extends Throwable> {
        R apply (P param) throws E;
    }

    private static final class ASuccess<T> extends ATry<T> {
        private final T value;

        ASuccess (T value) {
            this.value = value;
        }

        @Override public <E extends Throwable> void foreach (AStatement1<T, E> f) throws E {
            f.apply (value);
        }

        @Override public ATry<Throwable> inverse () {
            return failure (new IllegalStateException ("inverse of a success: " + value));
        }

        @Override public <S, E extends Throwable> ATry<S> map (ATryFunction<T, S, E> f) throws E {
            return success (f.apply (value));
        }

        @Override public boolean isSuccess () {
            return true;
        }

        @Override public T getValue () {
            return value;
        }

        @Override public Throwable getFailure () {
            throw new IllegalStateException ("not a failure");
        }

        @Override public T getOrThrow () {
            return value;
        }

        @Override public boolean equals (Object o) {
            if (this == o) return true;
            if (o == null || getClass () != o.getClass ()) return false;
            return Objects.equals (value, ((ASuccess<?>) o).value);
        }

        @Override public int hashCode () {
            return Objects.hashCode (value);
        }

        @Override public String toString () {
            return "ATry.success{" + value + '}';
        }
    }

    private static final class AFailure<T> extends ATry<T> {
        private final Throwable th;

        AFailure (Throwable th) {
            this.th = th;
        }

        @Override public <E extends Throwable> void foreach (AStatement1<T, E> f) {
        }

        @Override public ATry<Throwable> inverse () {
            return success (th);
        }

        @Override public <S, E extends Throwable> ATry<S> map (ATryFunction<T, S, E> f) {
            return failure (th);
        }

        @Override public boolean isSuccess () {
            return false;
        }

        @Override public T getValue () {
            throw new IllegalStateException ("not a success", th);
        }

        @Override public Throwable getFailure () {
            return th;
        }

        @Override public T getOrThrow () throws ExecutionException {
            throw new ExecutionException (th);
        }

        @Override public boolean equals (Object o) {
            if (this == o) return true;
            if (o == null || getClass () != o.getClass ()) return false;
            return th.equals (((AFailure<?>) o).th);
        }

        @Override public int hashCode () {
            return th.hashCode ();
        }

        @Override public String toString () {
            return "ATry.failure{" + th + '}';
        }
    }
}
