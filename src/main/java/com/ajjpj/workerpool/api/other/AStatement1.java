package com.ajjpj.workerpool.api.other;


/**
 * A statement with one parameter that may throw a checked exception of type E.
 */
public interface AStatement1<P, E extends Throwable> {
    void apply (P param) throws E;
}
