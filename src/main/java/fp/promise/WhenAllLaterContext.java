package fp.promise;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.logging.Logger;

import fp.util.Either;
import fp.util.Failure;

/**
 * Joins a list of futures into a plain callback. Nothing is returned to
 * chain on.
 */
final class WhenAllLaterContext<T> {
    private static final Logger LOG = Logger.getLogger(WhenAllLaterContext.class.getName());

    private final Consumer<List<Either<Failure, T>>> sink;
    private final AtomicReferenceArray<Either<Failure, T>> results;
    private final AtomicInteger count = new AtomicInteger(0);
    private volatile boolean released = false;

    WhenAllLaterContext(int total, Consumer<List<Either<Failure, T>>> sink) {
        this.results = new AtomicReferenceArray<>(total);
        this.sink = sink;
    }

    void start(List<Future<T>> inputs) {
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
                released = true;
                LOG.fine(() -> "Join aborted, future " + index + " rejected its callback");
                throw e;
            }
            input.close();
        }
    }

    private void complete() {
        final List<Either<Failure, T>> list = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            list.add(results.get(i));
        }
        released = true;
        LOG.fine(() -> "Join of " + results.length() + " futures delivered to callback");
        sink.accept(Collections.unmodifiableList(list));
    }

    boolean isReleased() {
        return released;
    }
}
