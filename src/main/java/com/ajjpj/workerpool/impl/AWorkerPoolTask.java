package com.ajjpj.workerpool.impl;

import com.ajjpj.workerpool.api.AQueuedTask;
import com.ajjpj.workerpool.api.ATaskFunction;
import com.ajjpj.workerpool.api.exc.ATaskDiscardedException;
import com.ajjpj.workerpool.api.other.ATry;

import java.util.concurrent.atomic.AtomicBoolean;


/**
 * A type-erased unit of work in the queue: submitted code bound to the future that receives its outcome. A task is executed or discarded
 *  at most once, and it is no longer in the queue when either happens.
 *
 * @author arno
 */
class AWorkerPoolTask<T> implements AQueuedTask {
    private final ATaskFunction<T> code;
    private final PoolCounters counters;

    /**
     * set by whoever executes or discards this task, so that only one of them ever happens
     */
    private final AtomicBoolean claimed = new AtomicBoolean (false);

    final AFutureImpl<T> future = new AFutureImpl<> ();

    AWorkerPoolTask (ATaskFunction<T> code, PoolCounters counters) {
        this.code = code;
        this.counters = counters;
    }

    @Override public void execute (int workerIdx) {
        if (! claimed.compareAndSet (false, true)) {
            return;
        }

        ATry<T> outcome;
        try {
            outcome = ATry.success (code.apply (workerIdx));
            if (AWorkerPoolImpl.SHOULD_GATHER_STATISTICS) counters.numExecuted.incrementAndGet ();
        }
        catch (Throwable th) {
            outcome = ATry.failure (th);
            if (AWorkerPoolImpl.SHOULD_GATHER_STATISTICS) counters.numFailed.incrementAndGet ();
        }
        future.complete (outcome);
    }

    void discard (String reason) {
        if (! claimed.compareAndSet (false, true)) {
            return;
        }

        if (AWorkerPoolImpl.SHOULD_GATHER_STATISTICS) counters.numDiscarded.incrementAndGet ();
        future.completeAsFailure (new ATaskDiscardedException (reason));
    }
}
