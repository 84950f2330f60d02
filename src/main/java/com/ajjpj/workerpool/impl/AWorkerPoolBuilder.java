package com.ajjpj.workerpool.impl;

import com.ajjpj.workerpool.api.AWorkerPool;
import com.ajjpj.workerpool.api.other.AStatement1;

import java.util.Objects;


//TODO configurable ThreadFactory instead of prefix / daemon flag, e.g. for thread priorities or thread groups

public class AWorkerPoolBuilder {
    static final String DEFAULT_THREAD_NAME_PREFIX = "a-worker";

    private int numThreads = Runtime.getRuntime ().availableProcessors ();
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private boolean daemonThreads = false;
    private Thread.UncaughtExceptionHandler uncaughtExceptionHandler = null;

    /**
     * The initial number of worker threads. 0 is valid: such a pool queues submitted work but does not execute it before it is resized.
     */
    public AWorkerPoolBuilder withNumThreads (int numThreads) {
        if (numThreads < 0) {
            throw new IllegalArgumentException ("number of threads must not be negative: " + numThreads);
        }
        this.numThreads = numThreads;
        return this;
    }

    /**
     * Worker threads are named {@code <prefix>-<pool number>-<worker index>}.
     */
    public AWorkerPoolBuilder withThreadNamePrefix (String threadNamePrefix) {
        this.threadNamePrefix = Objects.requireNonNull (threadNamePrefix, "threadNamePrefix");
        return this;
    }

    public AWorkerPoolBuilder withDaemonThreads (boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    /**
     * Failures of submitted code are reported through their futures; this handler only sees failures of the worker threads themselves.
     */
    public AWorkerPoolBuilder withUncaughtExceptionHandler (Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
        return this;
    }

    public <T extends Throwable> AWorkerPoolBuilder log (AStatement1<String, T> logOperation) throws T {
        final String stringRepresentation = toString ();
        logOperation.apply (stringRepresentation);
        return this;
    }

    public AWorkerPool build () {
        return new AWorkerPoolImpl (numThreads, threadNamePrefix, daemonThreads, uncaughtExceptionHandler);
    }

    @Override
    public String toString () {
        return "AWorkerPoolBuilder{" +
                "numThreads=" + numThreads +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                ", daemonThreads=" + daemonThreads +
                ", uncaughtExceptionHandler=" + uncaughtExceptionHandler +
                '}';
    }
}
