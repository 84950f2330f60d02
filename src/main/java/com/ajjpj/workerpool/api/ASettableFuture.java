package com.ajjpj.workerpool.api;

import com.ajjpj.workerpool.api.other.ATry;


public interface ASettableFuture<T> extends AFuture<T> {
    /**
     * @throws IllegalStateException if the future was completed before
     */
    void complete (ATry<T> o);

    /**
     * @return true if this call completed the future, false if it was completed before
     */
    boolean tryComplete (ATry<T> o);

    default void completeAsSuccess (T o) {
        complete (ATry.success (o));
    }

    default void completeAsFailure (Throwable th) {
        complete (ATry.failure (th));
    }
}
