package fp.promise;

import java.util.concurrent.atomic.AtomicBoolean;

import fp.util.Either;
import fp.util.ExceptionFailure;
import fp.util.Failure;
import fp.util.Left;
import fp.util.Right;
import fp.util.Failure.SupplierCatch;

/**
 * The producer side of a single asynchronous value.
 * <p>
 * A promise is fulfilled at most once. Closing an unfulfilled promise
 * fulfils it with a {@link BrokenPromiseException}, so its future never
 * waits forever.
 *
 * @param <T> the type of the value
 */
public class Promise<T> implements AutoCloseable {
    private final Core<T> core = new Core<T>();
    private final AtomicBoolean retrieved = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @throws FutureAlreadyRetrievedException on the second call
     */
    public Future<T> getFuture() {
        if (!retrieved.compareAndSet(false, true)) {
            throw new FutureAlreadyRetrievedException();
        }
        return new Future<T>(core);
    }

    public void setValue(T value) {
        setResult(Right.of(value));
    }

    public void setFailure(Failure failure) {
        setResult(Left.of(failure));
    }

    public void setException(Throwable throwable) {
        setFailure(ExceptionFailure.of(throwable));
    }

    /**
     * @throws DoubleSetException if the promise was already fulfilled
     */
    public void setResult(Either<Failure, T> result) {
        core.setResult(result);
    }

    /**
     * Fulfils the promise with the value of the supplier, or with the
     * exception it throws.
     */
    public <E extends Exception> void fulfil(SupplierCatch<E, T> supplier) {
        setResult(ExceptionFailure.tryCatch(supplier));
    }

    public boolean isFulfilled() {
        return core.isReady();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (retrieved.compareAndSet(false, true)) {
                core.detachFuture();
            }
            core.detachPromise();
        }
    }

    Core<T> core() {
        return core;
    }
}
