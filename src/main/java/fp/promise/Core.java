package fp.promise;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

import fp.io.Scheduler;
import fp.util.Either;
import fp.util.ExceptionFailure;
import fp.util.Failure;
import fp.util.Left;

/**
 * The state shared by a {@link Promise} and its {@link Future}.
 * <p>
 * A core has no owner. Each of the two handles detaches from it exactly
 * once, and the core is disposed when the second one does. Both detach
 * paths make sure a result and a callback exist, so by then the callback
 * has already been fired.
 * <p>
 * The lock serializes setting the result and the callback and the decision
 * to fire. The callback is marked as fired before the lock is released, and
 * it always runs outside of it, either on the calling thread or on the
 * installed {@link Scheduler}.
 *
 * @param <T> the type of the value
 */
final class Core<T> {
    private static final Logger LOG = Logger.getLogger(Core.class.getName());

    private final ReentrantLock lock = new ReentrantLock();

    private volatile Either<Failure, T> result = null;
    private Consumer<Either<Failure, T>> callback = null;
    private boolean calledBack = false;
    private int detached = 0;
    private volatile boolean active = true;
    private Scheduler scheduler = null;
    private volatile boolean disposed = false;

    Core() {
    }

    /**
     * @return the committed result
     * @throws NotReadyException if no result has been committed yet
     */
    Either<Failure, T> readResult() {
        final Either<Failure, T> value = result;
        if (value == null) {
            throw new NotReadyException();
        }
        return value;
    }

    boolean isReady() {
        return result != null;
    }

    void setCallback(Consumer<Either<Failure, T>> func) {
        Objects.requireNonNull(func, "callback");
        lock.lock();
        try {
            if (callback != null) {
                throw new DoubleSetException("setCallback called twice");
            }
            callback = func;
        } finally {
            lock.unlock();
        }

        maybeCallback();
    }

    void setResult(Either<Failure, T> value) {
        Objects.requireNonNull(value, "result");
        lock.lock();
        try {
            if (result != null) {
                throw new DoubleSetException("setResult called twice");
            }
            result = value;
        } finally {
            lock.unlock();
        }

        maybeCallback();
    }

    // Called by a closing Future
    void detachFuture() {
        lock.lock();
        try {
            if (callback == null) {
                callback = Core::ignore;
            }
            active = true;
        } finally {
            lock.unlock();
        }

        try {
            maybeCallback();
        } finally {
            detachOne();
        }
    }

    // Called by a closing Promise
    void detachPromise() {
        lock.lock();
        try {
            if (result == null) {
                LOG.fine("Promise closed without a result, breaking it");
                result = Left.of(ExceptionFailure.of(new BrokenPromiseException()));
            }
        } finally {
            lock.unlock();
        }

        try {
            maybeCallback();
        } finally {
            detachOne();
        }
    }

    void deactivate() {
        lock.lock();
        try {
            active = false;
        } finally {
            lock.unlock();
        }
    }

    void activate() {
        lock.lock();
        try {
            active = true;
        } finally {
            lock.unlock();
        }

        maybeCallback();
    }

    boolean isActive() {
        return active;
    }

    void setScheduler(Scheduler scheduler) {
        lock.lock();
        try {
            this.scheduler = scheduler;
        } finally {
            lock.unlock();
        }
    }

    boolean isDisposed() {
        return disposed;
    }

    private void maybeCallback() {
        final Consumer<Either<Failure, T>> func;
        final Either<Failure, T> value;
        final Scheduler target;

        lock.lock();
        try {
            if (calledBack || result == null || callback == null || !active) {
                return;
            }
            calledBack = true;
            func = callback;
            value = result;
            target = scheduler;
        } finally {
            lock.unlock();
        }

        if (target == null) {
            LOG.finer("Running callback inline");
            func.accept(value);
            return;
        }

        try {
            target.add(() -> func.accept(value));
        } catch (RuntimeException e) {
            // a rejected hand-off leaves the callback unfired
            lock.lock();
            try {
                calledBack = false;
            } finally {
                lock.unlock();
            }
            throw e;
        }
        LOG.finer("Callback handed to scheduler");
    }

    private void detachOne() {
        final boolean shouldDispose;
        lock.lock();
        try {
            if (detached == 2) {
                throw new IllegalStateException("Both sides have already detached");
            }
            detached++;
            shouldDispose = detached == 2;
        } finally {
            lock.unlock();
        }

        if (shouldDispose) {
            dispose();
        }
    }

    private void dispose() {
        lock.lock();
        try {
            if (!calledBack) {
                throw new IllegalStateException("Disposed before the callback fired");
            }
            callback = null;
            scheduler = null;
            disposed = true;
        } finally {
            lock.unlock();
        }
        LOG.finer("Core disposed");
    }

    private static <T> void ignore(Either<Failure, T> value) {
    }
}
