package com.ajjpj.workerpool.api;


/**
 * A snapshot of a pool's counters. The values are read without synchronization, so they need not be consistent with each other; they
 *  are intended for monitoring, never for control flow.
 *
 * @author arno
 */
public class AWorkerPoolStatistics {
    public final int size;
    public final int numIdle;
    public final int approximateQueueSize;

    public final long numSubmitted;
    public final long numExecuted;
    public final long numFailed;
    public final long numDiscarded;

    public AWorkerPoolStatistics (int size, int numIdle, int approximateQueueSize, long numSubmitted, long numExecuted, long numFailed, long numDiscarded) {
        this.size = size;
        this.numIdle = numIdle;
        this.approximateQueueSize = approximateQueueSize;
        this.numSubmitted = numSubmitted;
        this.numExecuted = numExecuted;
        this.numFailed = numFailed;
        this.numDiscarded = numDiscarded;
    }

    @Override public String toString () {
        return "AWorkerPoolStatistics{" +
                "size=" + size +
                ", numIdle=" + numIdle +
                ", approximateQueueSize=" + approximateQueueSize +
                ", numSubmitted=" + numSubmitted +
                ", numExecuted=" + numExecuted +
                ", numFailed=" + numFailed +
                ", numDiscarded=" + numDiscarded +
                '}';
    }
}
