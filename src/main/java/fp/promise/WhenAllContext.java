package fp.promise;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Logger;

import fp.util.Either;
import fp.util.Failure;

/**
 * Joins a list of futures of the same type into a future of the list of
 * their outcomes, in input order.
 */
final class WhenAllContext<T> {
    private static final Logger LOG = Logger.getLogger(WhenAllContext.class.getName());

    private final Promise<List<Either<Failure, T>>> promise = new Promise<>();
    private final Future<List<Either<Failure, T>>> future = promise.getFuture();
    private final AtomicReferenceArray<Either<Failure, T>> results;
    private final AtomicInteger count = new AtomicInteger(0);
    private volatile boolean released = false;

    WhenAllContext(int total) {
        this.results = new AtomicReferenceArray<>(total);
    }

    Future<List<Either<Failure, T>>> start(List<Future<T>> inputs) {
        if (inputs.size() != results.length()) {
            throw new IllegalArgumentException(
                "Expected " + results.length() + " futures, got " + inputs.size()
            );
        }
        if (inputs.isEmpty()) {
            complete();
        }
        for (int i = 0; i < inputs.size(); i++) {
            final int index = i;
            final Future<T> input = inputs.get(i);
            try {
                input.setCallback(result -> {
                    results.set(index, result);
                    if (count.incrementAndGet() == results.length()) {
                        complete();
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

    private void complete() {
        final List<Either<Failure, T>> list = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            list.add(results.get(i));
        }
        try {
            promise.setValue(Collections.unmodifiableList(list));
        } finally {
            promise.close();
            released = true;
            LOG.fine(() -> "Join of " + results.length() + " futures completed");
        }
    }

    // Inputs after the one that failed are left untouched
    private void abort(int index) {
        LOG.fine(() -> "Join aborted, future " + index + " rejected its callback");
        try {
            promise.close();
        } finally {
            future.close();
            released = true;
        }
    }

    boolean isReleased() {
        return released;
    }
}
