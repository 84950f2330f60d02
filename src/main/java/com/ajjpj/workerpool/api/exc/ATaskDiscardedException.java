package com.ajjpj.workerpool.api.exc;


/**
 * The failure a task's future completes with if the task was removed from the queue without ever being executed, i.e. by
 *  {@code stop(false)}, by {@code clearQueue()}, or because it was submitted while the pool was shutting down.
 *
 * @author arno
 */
public class ATaskDiscardedException extends RuntimeException {
    public ATaskDiscardedException (String msg) {
        super (msg);
    }

    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
