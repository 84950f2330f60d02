package com.ajjpj.workerpool.impl;

import com.ajjpj.workerpool.api.other.ATry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;


public class AFutureImplTest {
    @Test
    public void testCompleteAsSuccess() throws Exception {
        final AFutureImpl<String> f = new AFutureImpl<> ();
        assertFalse (f.isDone ());
        assertFalse (f.optValue ().isPresent ());

        f.completeAsSuccess ("a");
        assertTrue (f.isDone ());
        assertTrue (f.isSuccess ());
        assertFalse (f.isFailure ());
        assertEquals ("a", f.get ());
        assertEquals (ATry.success ("a"), f.optValue ().get ());
    }

    @Test
    public void testCompleteAsFailure() {
        final AFutureImpl<String> f = new AFutureImpl<> ();
        final RuntimeException failure = new RuntimeException ("x");
        f.completeAsFailure (failure);

        assertTrue (f.isFailure ());
        final ExecutionException exc = assertThrows (ExecutionException.class, f::get);
        assertSame (failure, exc.getCause ());
    }

    @Test
    public void testCompletesOnlyOnce() throws Exception {
        final AFutureImpl<Integer> f = new AFutureImpl<> ();
        assertTrue (f.tryComplete (ATry.success (1)));
        assertFalse (f.tryComplete (ATry.success (2)));
        assertThrows (IllegalStateException.class, () -> f.completeAsSuccess (3));
        assertEquals (1, f.get ());
    }

    @Test
    public void testTimedGet() throws Exception {
        final AFutureImpl<Integer> f = new AFutureImpl<> ();
        assertThrows (TimeoutException.class, () -> f.get (10, TimeUnit.MILLISECONDS));

        f.completeAsSuccess (5);
        assertEquals (5, f.get (10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testGetBlocksUntilCompleted() throws Exception {
        final AFutureImpl<Integer> f = new AFutureImpl<> ();
        final CountDownLatch waiting = new CountDownLatch (1);
        final List<Integer> result = new ArrayList<> ();

        final Thread t = new Thread (() -> {
            waiting.countDown ();
            try {
                result.add (f.get ());
            }
            catch (Exception e) {
                throw new RuntimeException (e);
            }
        });
        t.start ();
        assertTrue (waiting.await (1, TimeUnit.SECONDS));

        f.completeAsSuccess (99);
        t.join (TimeUnit.SECONDS.toMillis (10));
        assertEquals (99, result.get (0).intValue ());
    }

    @Test
    public void testHandlers() {
        final AFutureImpl<String> f = new AFutureImpl<> ();
        final List<String> log = new ArrayList<> ();

        f.onComplete (t -> log.add ("before: " + t.getValue ()));
        f.onSuccess (s -> log.add ("success: " + s));
        f.onFailure (th -> log.add ("failure: " + th));
        assertTrue (log.isEmpty ());

        f.completeAsSuccess ("x");
        f.onComplete (t -> log.add ("after: " + t.getValue ()));

        assertEquals (3, log.size ());
        assertEquals ("before: x", log.get (0));
        assertEquals ("success: x", log.get (1));
        assertEquals ("after: x", log.get (2));
    }

    @Test
    public void testFailureHandlers() {
        final AFutureImpl<String> f = new AFutureImpl<> ();
        final List<Throwable> failures = new ArrayList<> ();
        final List<String> successes = new ArrayList<> ();

        f.onFailure (failures::add);
        f.onSuccess (successes::add);

        final IllegalStateException failure = new IllegalStateException ();
        f.completeAsFailure (failure);

        assertEquals (1, failures.size ());
        assertSame (failure, failures.get (0));
        assertTrue (successes.isEmpty ());
    }

    @Test
    public void testFailingHandlerDoesNotAffectOthers() {
        final AFutureImpl<String> f = new AFutureImpl<> ();
        final List<String> log = new ArrayList<> ();

        f.onComplete (t -> { throw new RuntimeException ("handler failure"); });
        f.onComplete (t -> log.add (t.getValue ()));

        assertTrue (f.tryComplete (ATry.success ("y")));
        assertEquals (1, log.size ());
    }
}
