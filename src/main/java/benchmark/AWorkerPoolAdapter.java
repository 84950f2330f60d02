package benchmark;

import com.ajjpj.workerpool.api.AWorkerPool;

import java.util.concurrent.Callable;


/**
 * @author arno
 */
class AWorkerPoolAdapter implements BenchmarkPool {
    final AWorkerPool inner;

    AWorkerPoolAdapter (AWorkerPool inner) {
        this.inner = inner;
    }

    @Override public <T> Result<T> submit (Callable<T> code) {
        return inner.submit (code)::get;
    }

    @Override public void shutdown () {
        inner.stop (true);
    }
}
