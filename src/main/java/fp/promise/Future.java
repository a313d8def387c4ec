package fp.promise;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import fp.io.Scheduler;
import fp.util.Either;
import fp.util.Failure;

/**
 * The consumer side of a single asynchronous value.
 * <p>
 * At most one callback can be set. Closing the future tells the shared state
 * that nobody else will listen; a result delivered after that is dropped.
 *
 * @param <T> the type of the value
 */
public class Future<T> implements AutoCloseable {
    private final Core<T> core;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Future(Core<T> core) {
        this.core = core;
    }

    /**
     * Sets the callback that receives the result. It runs exactly once: on the
     * scheduler if one was set with {@link #via}, otherwise on the thread that
     * completes the last of result, callback and activation.
     *
     * @throws DoubleSetException if a callback was already set
     */
    public void setCallback(Consumer<Either<Failure, T>> callback) {
        core.setCallback(callback);
    }

    /**
     * @return the result, without waiting
     * @throws NotReadyException if the promise has not been fulfilled yet
     */
    public Either<Failure, T> getResult() {
        return core.readResult();
    }

    public boolean isReady() {
        return core.isReady();
    }

    /**
     * Runs the callback on the given scheduler. Must be called before the
     * callback would otherwise fire inline.
     */
    public Future<T> via(Scheduler scheduler) {
        core.setScheduler(scheduler);
        return this;
    }

    public Future<T> activate() {
        core.activate();
        return this;
    }

    public Future<T> deactivate() {
        core.deactivate();
        return this;
    }

    public boolean isActive() {
        return core.isActive();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            core.detachFuture();
        }
    }
}
