package com.ajjpj.workerpool.api.exc;

import java.util.concurrent.RejectedExecutionException;


/**
 * Thrown synchronously by {@code submit} when the pool was already stopped.
 */
public class RejectedExecutionExceptionWithoutStacktrace extends RejectedExecutionException {
    public RejectedExecutionExceptionWithoutStacktrace (String msg) {
        super (msg);
    }

    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
