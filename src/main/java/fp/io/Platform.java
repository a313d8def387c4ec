package fp.io;

import java.util.concurrent.ExecutorService;

public interface Platform {
    ExecutorService getExecutor();
    Scheduler getScheduler();

    void shutdown();
}
