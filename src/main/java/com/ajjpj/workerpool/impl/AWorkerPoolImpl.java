package com.ajjpj.workerpool.impl;

import com.ajjpj.workerpool.api.AFuture;
import com.ajjpj.workerpool.api.AQueuedTask;
import com.ajjpj.workerpool.api.ATaskFunction;
import com.ajjpj.workerpool.api.AWorkerPool;
import com.ajjpj.workerpool.api.AWorkerPoolStatistics;
import com.ajjpj.workerpool.api.exc.RejectedExecutionExceptionWithoutStacktrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * The pool keeps its worker threads and their stop flags in two lists of equal size; the list index is the index that is passed to a
 *  task's code. The queue has a lock of its own, the pool's monitor guards everything related to waiting for work: the idle counter,
 *  the 'done' flag and the conditions workers wait on.<p>
 *
 * {@link #resize(int)} and {@link #stop(boolean)} must be called by one thread at a time, which is the only thread that modifies the
 *  lists of workers and stop flags.
 *
 * @author arno
 */
public class AWorkerPoolImpl implements AWorkerPool {
    private static final Logger log = LoggerFactory.getLogger (AWorkerPoolImpl.class);

    public static final boolean SHOULD_GATHER_STATISTICS = true; // compile-time switch to enable / disable statistics gathering

    private static final AtomicInteger nextPoolId = new AtomicInteger (1);

    final TaskQueue queue = new TaskQueue ();

    final Lock monitor = new ReentrantLock ();
    final Condition workAvailable = monitor.newCondition ();
    /**
     * signalled whenever a worker starts or stops waiting, and when the pool's size or state changes
     */
    final Condition quiescenceChanged = monitor.newCondition ();

    /**
     * the number of waiting workers that are still part of the pool; modified only while holding the monitor
     */
    final AtomicInteger numIdle = new AtomicInteger (0);

    /**
     * true once stop(true) was called: workers terminate when they find the queue empty
     */
    volatile boolean done = false;
    /**
     * true once stop(false) was called: queued work is discarded
     */
    private volatile boolean stopped = false;

    private final List<WorkerThread> workers = new ArrayList<> ();
    private final List<AtomicBoolean> stopFlags = new ArrayList<> ();
    private volatile int size = 0;

    private final PoolCounters counters = new PoolCounters ();

    /**
     * {@code <prefix>-<pool number>}, used for log output and as the prefix of worker thread names
     */
    private final String name;
    private final boolean daemonThreads;
    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;

    public AWorkerPoolImpl () {
        this (Runtime.getRuntime ().availableProcessors ());
    }

    public AWorkerPoolImpl (int numThreads) {
        this (numThreads, AWorkerPoolBuilder.DEFAULT_THREAD_NAME_PREFIX, false, null);
    }

    AWorkerPoolImpl (int numThreads, String threadNamePrefix, boolean daemonThreads, Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.name = threadNamePrefix + "-" + nextPoolId.getAndIncrement ();
        this.daemonThreads = daemonThreads;
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;

        resize (numThreads);
    }

    @Override public <T> AFuture<T> submit (ATaskFunction<T> code) {
        Objects.requireNonNull (code, "code");
        if (stopped || done) {
            throw new RejectedExecutionExceptionWithoutStacktrace ("pool is already stopped");
        }

        final AWorkerPoolTask<T> task = new AWorkerPoolTask<> (code, counters);
        if (SHOULD_GATHER_STATISTICS) counters.numSubmitted.incrementAndGet ();
        queue.push (task);

        monitor.lock ();
        try {
            workAvailable.signal ();
        }
        finally {
            monitor.unlock ();
        }

        // a concurrent stop() may have passed its final drain before the push, and the task would never be picked up
        if (stopped) {
            queue.drainAndDiscard ("pool was stopped");
        }
        else if (done && size == 0) {
            queue.drainAndDiscard ("pool was finished");
        }

        return task.future;
    }

    @Override public void resize (int numThreads) {
        if (numThreads < 0) {
            throw new IllegalArgumentException ("number of threads must not be negative: " + numThreads);
        }
        if (stopped || done) {
            return;
        }

        final int oldSize = workers.size ();
        if (numThreads >= oldSize) {
            for (int i=oldSize; i<numThreads; i++) {
                final AtomicBoolean stopFlag = new AtomicBoolean (false);
                final WorkerThread worker = new WorkerThread (this, i, stopFlag, name + "-" + i);
                worker.setDaemon (daemonThreads);
                if (uncaughtExceptionHandler != null) {
                    worker.setUncaughtExceptionHandler (uncaughtExceptionHandler);
                }

                stopFlags.add (stopFlag);
                workers.add (worker);
                worker.start ();
            }
        }
        else {
            for (int i=numThreads; i<oldSize; i++) {
                stopFlags.get (i).set (true);
            }

            // removed workers that are waiting stop counting as idle right away, not when they get around to waking up
            monitor.lock ();
            try {
                for (WorkerThread removed: workers.subList (numThreads, oldSize)) {
                    if (removed.countedAsIdle) {
                        removed.countedAsIdle = false;
                        numIdle.decrementAndGet ();
                    }
                }
            }
            finally {
                monitor.unlock ();
            }

            // removed workers are not joined: they may still be busy with a task, and they terminate on their own
            workers.subList (numThreads, oldSize).clear ();
            stopFlags.subList (numThreads, oldSize).clear ();
        }
        size = numThreads;

        signalAllUnderMonitor ();
        log.debug ("resized pool {} from {} to {} worker threads", name, oldSize, numThreads);
    }

    @Override public void stop (boolean finish) {
        if (finish) {
            if (done || stopped) {
                return;
            }
            done = true;
        }
        else {
            if (stopped || done) {
                return;
            }
            stopped = true;
            for (AtomicBoolean stopFlag: stopFlags) {
                stopFlag.set (true);
            }
            final int numDiscarded = queue.drainAndDiscard ("pool was stopped");
            log.debug ("stopping pool {}, discarded {} queued tasks", name, numDiscarded);
        }

        signalAllUnderMonitor ();
        joinWorkers ();

        workers.clear ();
        stopFlags.clear ();
        size = 0;

        // tasks that were submitted concurrently with stopping, or that were queued in a pool without workers
        final int numLeftOver = queue.drainAndDiscard (finish ? "pool was finished" : "pool was stopped");
        if (numLeftOver > 0) {
            log.debug ("discarded {} tasks that were left in the queue of pool {}", numLeftOver, name);
        }
        signalAllUnderMonitor ();
        log.debug ("pool {} is {}", name, getState ());
    }

    private void joinWorkers () {
        boolean interrupted = false;
        for (WorkerThread worker: workers) {
            if (worker == Thread.currentThread ()) {
                log.warn ("pool {} was stopped from its own worker thread {}, which is therefore not joined", name, worker.getName ());
                continue;
            }
            while (true) {
                try {
                    worker.join ();
                    break;
                }
                catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread ().interrupt ();
        }
    }

    private void signalAllUnderMonitor () {
        monitor.lock ();
        try {
            workAvailable.signalAll ();
            quiescenceChanged.signalAll ();
        }
        finally {
            monitor.unlock ();
        }
    }

    @Override public int clearQueue () {
        final int result = queue.drainAndDiscard ("queue was cleared");
        signalAllUnderMonitor ();
        return result;
    }

    @Override public Optional<AQueuedTask> pollTask () {
        return Optional.ofNullable (queue.tryPop ());
    }

    @Override public void awaitQuiescence () throws InterruptedException {
        monitor.lock ();
        try {
            while (! isQuiescent ()) {
                quiescenceChanged.await ();
            }
        }
        finally {
            monitor.unlock ();
        }
    }

    @Override public boolean awaitQuiescence (long timeout, TimeUnit timeUnit) throws InterruptedException {
        long nanos = timeUnit.toNanos (timeout);

        monitor.lock ();
        try {
            while (! isQuiescent ()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = quiescenceChanged.awaitNanos (nanos);
            }
            return true;
        }
        finally {
            monitor.unlock ();
        }
    }

    /**
     * must be called while holding the monitor
     */
    private boolean isQuiescent () {
        if (stopped || done) {
            return true;
        }

        final boolean queueEmpty = queue.isEmpty ();
        if (size == 0 && ! queueEmpty) {
            throw new IllegalStateException ("pool has no worker threads and will never execute the tasks in its queue");
        }
        return queueEmpty && numIdle.get () == size;
    }

    @Override public int size () {
        return size;
    }

    @Override public int getNumIdle () {
        return numIdle.get ();
    }

    @Override public State getState () {
        if (stopped) return State.Stopped;
        if (done) return State.Finished;
        return State.Running;
    }

    /**
     * This method returns an approximation of the pool's statistics. Counters are updated without synchronization between each other,
     *  so the returned numbers may be inconsistent, e.g. a task may already be counted as executed but not yet as submitted.
     */
    @Override public AWorkerPoolStatistics getStatistics () {
        return new AWorkerPoolStatistics (
                size,
                numIdle.get (),
                queue.approximateSize (),
                counters.numSubmitted.get (),
                counters.numExecuted.get (),
                counters.numFailed.get (),
                counters.numDiscarded.get ());
    }

    @Override public String toString () {
        return "AWorkerPoolImpl{" +
                "name='" + name + '\'' +
                ", state=" + getState () +
                ", size=" + size +
                ", numIdle=" + numIdle.get () +
                '}';
    }
}
