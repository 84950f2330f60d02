package benchmark;

import com.ajjpj.workerpool.api.AWorkerPoolStatistics;
import com.ajjpj.workerpool.impl.AWorkerPoolBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.*;


/**
 * @author arno
 */
@Fork (1)
@Threads (1)
@Warmup (iterations = 3, time = 1)
@Measurement (iterations = 3, time = 3)
@State (Scope.Benchmark)
public class PoolBenchmark {
    private static final int NUM_THREADS = 8;

    BenchmarkPool pool;

    @Param ({
            "a-worker-pool",
            "Fixed",
//            "ForkJoinFifo",
    })
    public String strategy;

    @Setup
    public void setUp() {
        switch (strategy) {
            case "a-worker-pool": pool = new AWorkerPoolAdapter (new AWorkerPoolBuilder ().withNumThreads (NUM_THREADS).withDaemonThreads (true).build ()); break;
            case "Fixed":         pool = new DelegatingPool (Executors.newFixedThreadPool (NUM_THREADS)); break;
            case "ForkJoinFifo":  pool = new DelegatingPool (new ForkJoinPool (NUM_THREADS, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, true)); break;

            default: throw new IllegalStateException ("unknown strategy " + strategy);
        }
    }

    @TearDown
    public void tearDown() throws InterruptedException {
        pool.shutdown ();

        if (pool instanceof AWorkerPoolAdapter) {
            final AWorkerPoolStatistics stats = ((AWorkerPoolAdapter) pool).inner.getStatistics ();
            System.out.println ();
            System.out.println ("---- Worker Pool Statistics ----");
            System.out.println (stats);
            System.out.println ("--------------------------------");
        }
    }

    @Benchmark
    public void testSimpleScheduling01() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            pool.submit (() -> {
                latch.countDown ();
                return null;});
        }
        latch.await ();
    }

    @Benchmark
    @Threads (7)
    public void testSimpleScheduling07() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            pool.submit (() -> {
                latch.countDown ();
                return null;});
        }
        latch.await ();
    }

    @Benchmark
    public void testExpensive() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            pool.submit (() -> {
                Blackhole.consumeCPU (100);
                latch.countDown ();
                return null;
            });
        }
        latch.await ();
    }

    @Benchmark
    public void testFactorialSingle() throws ExecutionException, InterruptedException {
        final CompletableFuture<Long> fact = new CompletableFuture<> ();
        fact (1, 12, fact);
        fact.get ();
    }

    @Benchmark
    @Threads (7)
    public void testFactorialMulti7() throws ExecutionException, InterruptedException {
        final CompletableFuture<Long> fact = new CompletableFuture<> ();
        fact (1, 12, fact);
        fact.get ();
    }

    void fact (long collect, int n, CompletableFuture<Long> result) {
        if (n <= 1) {
            result.complete (collect);
        }
        else {
            pool.submit (() -> {
                fact (collect * n, n-1, result);
                return null;
            });
        }
    }

    @Benchmark
    public void testPingPong01() throws InterruptedException {
        testPingPong (1);
    }

    @Benchmark
    public void testPingPong07() throws InterruptedException {
        testPingPong (7);
    }

    private void testPingPong(int numThreads) throws InterruptedException {
        final PingPongActor a1 = new PingPongActor ();
        final PingPongActor a2 = new PingPongActor ();

        final CountDownLatch latch = new CountDownLatch (numThreads);

        for (int i=0; i<numThreads; i++) {
            a1.receive (a2, 10_000, latch::countDown);
        }

        latch.await ();
    }

    class PingPongActor {
        void receive (PingPongActor sender, int remaining, Runnable onFinished) {
            if (remaining == 0) {
                onFinished.run ();
            }
            else {
                pool.submit (() -> {sender.receive (PingPongActor.this, remaining-1, onFinished); return null;});
            }
        }
    }
}
