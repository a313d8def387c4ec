package fp.io;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Queues work until the owner drains it. Work is run on the draining
 * thread, in submission order.
 */
public class ManualScheduler implements Scheduler {
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void add(Runnable work) {
        queue.add(work);
    }

    /**
     * Runs the oldest queued unit of work, if any.
     *
     * @return false if the queue was empty
     */
    public boolean runOnce() {
        final Runnable work = queue.poll();
        if (work == null) {
            return false;
        }
        work.run();
        return true;
    }

    /**
     * Runs queued work until the queue is empty, including work added while
     * draining.
     *
     * @return the number of units run
     */
    public int run() {
        int count = 0;
        while (runOnce()) {
            count++;
        }
        return count;
    }

    public int size() {
        return queue.size();
    }
}
