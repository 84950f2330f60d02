package com.ajjpj.workerpool.impl;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * The pool's FIFO of pending tasks. It is guarded by a lock of its own, separate from the pool's monitor, so that pushing and popping
 *  never contend with idle / wake-up bookkeeping. No method blocks other than for the duration of a single queue operation.
 *
 * @author arno
 */
class TaskQueue {
    private final Lock lock = new ReentrantLock ();
    private final Queue<AWorkerPoolTask<?>> tasks = new ArrayDeque<> ();

    void push (AWorkerPoolTask<?> task) {
        lock.lock ();
        try {
            tasks.add (task);
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * @return the first task, or null if the queue is empty
     */
    AWorkerPoolTask<?> tryPop () {
        lock.lock ();
        try {
            return tasks.poll ();
        }
        finally {
            lock.unlock ();
        }
    }

    boolean isEmpty () {
        lock.lock ();
        try {
            return tasks.isEmpty ();
        }
        finally {
            lock.unlock ();
        }
    }

    int approximateSize () {
        lock.lock ();
        try {
            return tasks.size ();
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * Removes all tasks without executing them. Their futures fail with an {@link com.ajjpj.workerpool.api.exc.ATaskDiscardedException}.
     *  Futures are completed outside the lock.
     *
     * @return the number of discarded tasks
     */
    int drainAndDiscard (String reason) {
        int result = 0;
        AWorkerPoolTask<?> task;
        while ((task = tryPop ()) != null) {
            task.discard (reason);
            result += 1;
        }
        return result;
    }
}
