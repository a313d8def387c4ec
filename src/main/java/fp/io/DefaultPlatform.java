package fp.io;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

public class DefaultPlatform implements Platform {
    private static final Logger LOG = Logger.getLogger(DefaultPlatform.class.getName());
    private static final AtomicInteger platformCount = new AtomicInteger();

    private final int number = platformCount.incrementAndGet();
    private final ExecutorService executor;
    private final Scheduler scheduler;

    public DefaultPlatform() {
        this(java.lang.Runtime.getRuntime().availableProcessors());
    }

    public DefaultPlatform(int executorThreads) {
        if (executorThreads < 1) {
            throw new IllegalArgumentException(
                "executorThreads must be positive: " + executorThreads
            );
        }
        this.executor = Executors.newFixedThreadPool(
            executorThreads,
            new PlatformThreadFactory("io-executor")
        );
        this.scheduler = Scheduler.of(executor);
        LOG.fine(() -> "Platform " + number + " started with "
            + executorThreads + " executor threads");
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        LOG.fine(() -> "Platform " + number + " has shut down");
    }

    @Override
    public ExecutorService getExecutor() {
        return executor;
    }

    @Override
    public Scheduler getScheduler() {
        return scheduler;
    }

    class PlatformThreadFactory implements ThreadFactory {
        private final String poolName;
        private final AtomicInteger threadCount = new AtomicInteger();

        public PlatformThreadFactory(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(
                r,
                poolName + "-" + number + "-thread-" + threadCount.incrementAndGet()
            );
        }
    }
}
