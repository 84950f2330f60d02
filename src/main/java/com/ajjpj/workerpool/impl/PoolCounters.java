package com.ajjpj.workerpool.impl;

import java.util.concurrent.atomic.AtomicLong;


/**
 * Pool-wide statistics counters, shared between the pool and its tasks.
 */
class PoolCounters {
    final AtomicLong numSubmitted = new AtomicLong ();
    final AtomicLong numExecuted = new AtomicLong ();
    final AtomicLong numFailed = new AtomicLong ();
    final AtomicLong numDiscarded = new AtomicLong ();
}
