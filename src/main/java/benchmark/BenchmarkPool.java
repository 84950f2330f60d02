package benchmark;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;


/**
 * The common denominator of the pools that are compared in {@link PoolBenchmark}.
 *
 * @author arno
 */
public interface BenchmarkPool {
    <T> Result<T> submit (Callable<T> code);
    void shutdown () throws InterruptedException;

    interface Result<T> {
        T get () throws InterruptedException, ExecutionException;
    }
}
