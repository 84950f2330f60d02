package com.ajjpj.workerpool.api;

import com.ajjpj.workerpool.api.other.AStatement1;
import com.ajjpj.workerpool.api.other.ATry;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


/**
 * The result of a submitted task. It is completed exactly once, either with the task's return value or with the failure it threw.
 *
 * @author arno
 */
public interface AFuture<T> {
    boolean isDone ();

    default boolean isSuccess () {
        return optValue ().map (ATry::isSuccess).orElse (false);
    }
    default boolean isFailure () {
        return optValue ().map (ATry::isFailure).orElse (false);
    }

    /**
     * @return the outcome if this future is complete, {@code Optional.empty()} otherwise
     */
    Optional<ATry<T>> optValue ();

    /**
     * Blocks until this future is complete. A failure is reported as an {@link ExecutionException} with the original failure as its cause.
     */
    T get () throws InterruptedException, ExecutionException;
    T get (long timeout, TimeUnit timeUnit) throws InterruptedException, ExecutionException, TimeoutException;

    /**
     * Registers a handler that is called with the outcome when this future completes. If the future is complete already, the handler
     *  is called immediately in the calling thread, otherwise in the thread that completes the future.
     */
    AFuture<T> onComplete (AStatement1<ATry<T>, ? extends RuntimeException> handler);

    default AFuture<T> onSuccess (AStatement1<T, ? extends RuntimeException> handler) {
        return onComplete (t -> t.foreach (handler));
    }
    default AFuture<T> onFailure (AStatement1<Throwable, ? extends RuntimeException> handler) {
        return onComplete (t -> t.inverse ().foreach (handler));
    }
}
