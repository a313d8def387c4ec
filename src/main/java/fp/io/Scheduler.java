package fp.io;

import java.util.concurrent.Executor;

/**
 * Accepts units of work for later, asynchronous execution. No guarantee is
 * made about when or on which thread the work runs, and the submitter is
 * not notified on completion.
 */
@FunctionalInterface
public interface Scheduler {
    void add(Runnable work);

    public static Scheduler of(Executor executor) {
        return executor::execute;
    }
}
