package com.ajjpj.workerpool.api;


/**
 * A task that was taken out of a pool's queue by {@link AWorkerPool#pollTask()}. Whoever holds it owns it: calling {@link #execute(int)}
 *  runs the submitted code and completes its future, exactly as a worker thread would have done.
 *
 * @author arno
 */
public interface AQueuedTask {
    void execute (int workerIdx);
}
