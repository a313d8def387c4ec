package fp.promise;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import fp.util.Right;

/**
 * Races a list of futures. The first input to complete fulfils the output;
 * the context is released only after every input has reported, since their
 * callbacks stay registered until then.
 */
final class WhenAnyContext<T> {
    private static final Logger LOG = Logger.getLogger(WhenAnyContext.class.getName());

    private final Promise<RaceResult<T>> promise = new Promise<>();
    private final Future<RaceResult<T>> future = promise.getFuture();
    private final AtomicBoolean done = new AtomicBoolean(false);
    private final AtomicInteger refCount;
    private volatile boolean released = false;

    WhenAnyContext(int total) {
        if (total < 1) {
            throw new IllegalArgumentException("Cannot race an empty list of futures");
        }
        this.refCount = new AtomicInteger(total);
    }

    Future<RaceResult<T>> start(List<Future<T>> inputs) {
        if (inputs.size() != refCount.get()) {
            throw new IllegalArgumentException(
                "Expected " + refCount.get() + " futures, got " + inputs.size()
            );
        }
        for (int i = 0; i < inputs.size(); i++) {
            final int index = i;
            final Future<T> input = inputs.get(i);
            try {
                input.setCallback(result -> {
                    try {
                        if (done.compareAndSet(false, true)) {
                            LOG.finer(() -> "Future " + index + " won the race");
                            try {
                                promise.setResult(Right.of(new RaceResult<T>(index, result)));
                            } finally {
                                promise.close();
                            }
                        }
                    } finally {
                        decref();
                    }
                });
            } catch (RuntimeException e) {
                abort(index);
                throw e;
            }
            input.close();
        }
        return future;
    }

    // Inputs after the one that failed are left untouched
    private void abort(int index) {
        LOG.fine(() -> "Race aborted, future " + index + " rejected its callback");
        released = true;
        try {
            if (done.compareAndSet(false, true)) {
                promise.close();
            }
        } finally {
            future.close();
        }
    }

    private void decref() {
        if (refCount.decrementAndGet() == 0) {
            released = true;
            LOG.fine("Race completed, all futures reported");
        }
    }

    boolean isReleased() {
        return released;
    }

    int pending() {
        return refCount.get();
    }
}
