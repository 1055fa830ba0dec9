package xregrid.parallel;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Contexto local sobre un pool fijo de hilos.
 */
@Slf4j
public class LocalExecutionContext implements ExecutionContext, AutoCloseable {

    private final ExecutorService threadPool;
    private final int workers;

    public LocalExecutionContext(int workers) {
        this.workers = Math.max(workers, 1);
        this.threadPool = Executors.newFixedThreadPool(this.workers);
        log.info("LocalExecutionContext inicializado con {} workers.", this.workers);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        return threadPool.submit(task);
    }

    @Override
    public int parallelism() {
        return workers;
    }

    @Override
    public void close() {
        threadPool.shutdown();
        try {
            if (!threadPool.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("El pool de workers no terminó a tiempo; se fuerza el cierre.");
                threadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("LocalExecutionContext cerrado.");
    }
}
