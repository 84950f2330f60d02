package com.ajjpj.workerpool.api;

import com.ajjpj.workerpool.api.exc.ATaskDiscardedException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;


/**
 * A resizable pool of worker threads that execute submitted tasks in FIFO order from a single shared queue.<p>
 *
 * Submitting is safe from any number of threads concurrently. {@link #resize(int)} and {@link #stop(boolean)} on the other hand must be
 *  called by a single owner, i.e. callers must serialize them among themselves.<p>
 *
 * Once stopped, a pool can not be restarted.
 *
 * @author arno
 */
public interface AWorkerPool extends AutoCloseable {
    enum State { Running, Finished, Stopped }

    /**
     * Adds a task to the queue and returns its future without blocking. The task receives the index of the worker that executes it.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the pool was stopped
     */
    <T> AFuture<T> submit (ATaskFunction<T> code);

    default <P1, T> AFuture<T> submit (ATaskFunction1<P1, T> code, P1 p1) {
        Objects.requireNonNull (code, "code");
        return submit (idx -> code.apply (idx, p1));
    }

    default <P1, P2, T> AFuture<T> submit (ATaskFunction2<P1, P2, T> code, P1 p1, P2 p2) {
        Objects.requireNonNull (code, "code");
        return submit (idx -> code.apply (idx, p1, p2));
    }

    default <P1, P2, P3, T> AFuture<T> submit (ATaskFunction3<P1, P2, P3, T> code, P1 p1, P2 p2, P3 p3) {
        Objects.requireNonNull (code, "code");
        return submit (idx -> code.apply (idx, p1, p2, p3));
    }

    default <T> AFuture<T> submit (Callable<T> code) {
        Objects.requireNonNull (code, "code");
        return submit (idx -> code.call ());
    }

    default AFuture<Void> submit (Runnable code) {
        Objects.requireNonNull (code, "code");
        return submit (idx -> {
            code.run ();
            return null;
        });
    }

    /**
     * Changes the number of worker threads. Growing starts new workers, shrinking tells surplus workers to terminate after their current
     *  task without waiting for them. This is a no-op if the pool was stopped.
     *
     * @throws IllegalArgumentException if numThreads is negative
     */
    void resize (int numThreads);

    /**
     * Permanently retires the pool, blocking until all worker threads have terminated.<p>
     *
     * If {@code finish} is true, all tasks in the queue are executed before the workers terminate. Otherwise workers only finish the
     *  tasks they are currently running, and all queued tasks are discarded; their futures fail with an {@link ATaskDiscardedException}.
     */
    void stop (boolean finish);

    default void stop () {
        stop (false);
    }

    /**
     * Same as {@code stop(true)}.
     */
    @Override default void close () {
        stop (true);
    }

    /**
     * Discards all queued tasks, completing their futures with an {@link ATaskDiscardedException}.
     *
     * @return the number of discarded tasks
     */
    int clearQueue ();

    /**
     * Removes the next task from the queue without executing it. The caller takes responsibility for the task.
     */
    Optional<AQueuedTask> pollTask ();

    /**
     * Blocks until the queue is empty and all worker threads are idle. Returns immediately if the pool was stopped.
     *
     * @throws IllegalStateException if the pool has no worker threads but there are queued tasks
     */
    void awaitQuiescence () throws InterruptedException;

    /**
     * @return true if the pool became quiescent, false if the timeout elapsed before that
     */
    boolean awaitQuiescence (long timeout, TimeUnit timeUnit) throws InterruptedException;

    /**
     * @return the current number of worker threads. This is a snapshot for monitoring purposes only.
     */
    int size ();

    /**
     * @return the current number of worker threads waiting for work. This is a snapshot for monitoring purposes only.
     */
    int getNumIdle ();

    State getState ();

    AWorkerPoolStatistics getStatistics ();
}
