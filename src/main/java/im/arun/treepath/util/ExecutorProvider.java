package im.arun.treepath.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides a shared bounded thread pool for processing code units in parallel.
 * Units share no state, so any number may run at once; the pool only caps how many.
 */
public final class ExecutorProvider {
    private static ThreadPoolExecutor instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared ExecutorService. Path extraction is CPU-bound, so the default
     * size is the number of available processors.
     */
    public static ExecutorService getExecutor() {
        return getExecutor(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Returns the shared ExecutorService with {@code poolSize} threads, creating it if it
     * does not exist yet and resizing it otherwise.
     */
    public static ExecutorService getExecutor(int poolSize) {
        int size = Math.max(1, poolSize);
        synchronized (LOCK) {
            if (instance == null) {
                instance = (ThreadPoolExecutor) Executors.newFixedThreadPool(size, new ThreadFactory() {
                    private final AtomicInteger counter = new AtomicInteger(0);
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "treepath-worker-" + counter.incrementAndGet());
                        t.setDaemon(true);
                        return t;
                    }
                });
            } else if (instance.getCorePoolSize() != size) {
                // core may never exceed max, so the order depends on the direction
                if (size > instance.getMaximumPoolSize()) {
                    instance.setMaximumPoolSize(size);
                    instance.setCorePoolSize(size);
                } else {
                    instance.setCorePoolSize(size);
                    instance.setMaximumPoolSize(size);
                }
            }
            return instance;
        }
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
