package com.ajjpj.workerpool.api;


/**
 * Code that is submitted to an {@link AWorkerPool}. It receives the index of the worker thread that executes it.
 */
public interface ATaskFunction<T> {
    T apply (int workerIdx) throws Exception;
}
