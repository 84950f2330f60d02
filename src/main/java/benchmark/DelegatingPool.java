package benchmark;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;


/**
 * @author arno
 */
public class DelegatingPool implements BenchmarkPool {
    private final ExecutorService ec;

    public DelegatingPool (ExecutorService ec) {
        this.ec = ec;
    }

    @Override public <T> Result<T> submit (Callable<T> code) {
        return ec.submit (code)::get;
    }

    @Override public void shutdown () throws InterruptedException {
        ec.shutdown ();
        ec.awaitTermination (1, TimeUnit.MINUTES);
    }
}
