package com.ajjpj.workerpool.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;


/**
 * A worker drains the queue as long as it finds work there, and waits on the pool's monitor when it finds the queue empty. It terminates
 *  when its stop flag is set (after finishing the current task), or when the pool is finishing and there is no more work in the queue.<p>
 *
 * Once a worker was removed from the pool by shrinking it, nobody joins it. It holds everything it needs and terminates on its own.
 *
 * @author arno
 */
class WorkerThread extends Thread {
    private static final Logger log = LoggerFactory.getLogger (WorkerThread.class);

    final AWorkerPoolImpl pool;
    final int workerIdx;

    /**
     * Written by the pool, read by this thread. It is never reset once it is set.
     */
    final AtomicBoolean stopFlag;

    //---------------------------------------------------
    //-- statistics data, written only from this thread
    //---------------------------------------------------

    long stat_numTasksExecuted = 0;
    long stat_numWaits = 0;

    WorkerThread (AWorkerPoolImpl pool, int workerIdx, AtomicBoolean stopFlag, String name) {
        super (name);
        this.pool = pool;
        this.workerIdx = workerIdx;
        this.stopFlag = stopFlag;
    }

    /**
     * true while this worker is counted in the pool's idle counter. Guarded by the pool's monitor; the pool clears it when it removes
     *  this worker while it is waiting.
     */
    boolean countedAsIdle = false;

    @Override public void run () {
        log.debug ("worker {} started", getName ());

        while (! stopFlag.get ()) {
            AWorkerPoolTask<?> task = pool.queue.tryPop ();
            if (task == null) {
                task = awaitWork ();
                if (task == null) {
                    break;
                }
            }
            if (AWorkerPoolImpl.SHOULD_GATHER_STATISTICS) stat_numTasksExecuted += 1;
            task.execute (workerIdx);
        }

        log.debug ("worker {} terminated after executing {} tasks, waited {} times", getName (), stat_numTasksExecuted, stat_numWaits);
    }

    /**
     * Blocks on the pool's monitor until there is work in the queue or this worker should terminate. A worker whose stop flag is set
     *  never takes a task from here.
     *
     * @return the next task, or null if this worker should terminate
     */
    private AWorkerPoolTask<?> awaitWork () {
        if (AWorkerPoolImpl.SHOULD_GATHER_STATISTICS) stat_numWaits += 1;

        pool.monitor.lock ();
        try {
            if (stopFlag.get ()) {
                return null;
            }

            countedAsIdle = true;
            pool.numIdle.incrementAndGet ();
            pool.quiescenceChanged.signalAll ();
            try {
                while (true) {
                    if (stopFlag.get ()) {
                        return null;
                    }
                    // re-checking the queue while holding the monitor guarantees that no signal from 'submit' is lost
                    final AWorkerPoolTask<?> task = pool.queue.tryPop ();
                    if (task != null) {
                        return task;
                    }
                    if (pool.done) {
                        return null;
                    }
                    pool.workAvailable.awaitUninterruptibly ();
                }
            }
            finally {
                if (countedAsIdle) {
                    countedAsIdle = false;
                    pool.numIdle.decrementAndGet ();
                }
                pool.quiescenceChanged.signalAll ();
            }
        }
        finally {
            pool.monitor.unlock ();
        }
    }
}
