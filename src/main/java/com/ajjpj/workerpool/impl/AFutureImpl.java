package com.ajjpj.workerpool.impl;

import com.ajjpj.workerpool.api.ASettableFuture;
import com.ajjpj.workerpool.api.exc.TimeoutExceptionWithoutStackTrace;
import com.ajjpj.workerpool.api.other.AStatement1;
import com.ajjpj.workerpool.api.other.ATry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


/**
 * @author arno
 */
public class AFutureImpl<T> implements ASettableFuture<T> {
    private static final Logger log = LoggerFactory.getLogger (AFutureImpl.class);

    private final CountDownLatch latch = new CountDownLatch (1);

    private volatile ATry<T> value;

    /**
     * guarded by 'this'; set to null once the future is complete
     */
    private List<AStatement1<ATry<T>, ? extends RuntimeException>> handlers = new ArrayList<> ();

    @Override public boolean isDone () {
        return value != null;
    }

    @Override public Optional<ATry<T>> optValue () {
        return Optional.ofNullable (value);
    }

    @Override public T get () throws InterruptedException, ExecutionException {
        latch.await ();
        return value.getOrThrow ();
    }

    @Override public T get (long timeout, TimeUnit timeUnit) throws InterruptedException, ExecutionException, TimeoutException {
        if (! latch.await (timeout, timeUnit)) {
            throw new TimeoutExceptionWithoutStackTrace ("future was not completed within " + timeout + " " + timeUnit);
        }
        return value.getOrThrow ();
    }

    @Override public AFutureImpl<T> onComplete (AStatement1<ATry<T>, ? extends RuntimeException> handler) {
        Objects.requireNonNull (handler, "handler");

        synchronized (this) {
            if (handlers != null) {
                handlers.add (handler);
                return this;
            }
        }
        notifyHandler (handler, value);
        return this;
    }

    @Override public void complete (ATry<T> o) {
        if (! tryComplete (o)) {
            throw new IllegalStateException ("future was already completed");
        }
    }

    @Override public boolean tryComplete (ATry<T> o) {
        Objects.requireNonNull (o, "outcome");

        final List<AStatement1<ATry<T>, ? extends RuntimeException>> toNotify;
        synchronized (this) {
            if (value != null) {
                return false;
            }
            value = o;
            toNotify = handlers;
            handlers = null;
        }
        latch.countDown ();

        for (AStatement1<ATry<T>, ? extends RuntimeException> handler: toNotify) {
            notifyHandler (handler, o);
        }
        return true;
    }

    private void notifyHandler (AStatement1<ATry<T>, ? extends RuntimeException> handler, ATry<T> o) {
        try {
            handler.apply (o);
        }
        catch (RuntimeException exc) {
            // a failing handler must not keep other handlers from being called, nor affect the completing worker
            log.warn ("completion handler failed", exc);
        }
    }

    @Override public String toString () {
        final ATry<T> v = value;
        return "AFutureImpl{" + (v == null ? "<pending>" : v.toString ()) + '}';
    }
}
