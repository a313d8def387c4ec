package fp.promise;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;
import java.util.logging.Logger;

import fp.util.Either;
import fp.util.Failure;

/**
 * Joins a fixed number of futures of possibly different types. Each input
 * writes its outcome into its own slot; the input that brings the counter to
 * the total assembles the slots into {@code R} and fulfils the output.
 */
final class VariadicContext<R> {
    private static final Logger LOG = Logger.getLogger(VariadicContext.class.getName());

    private final Promise<R> promise = new Promise<R>();
    private final Future<R> future = promise.getFuture();
    private final AtomicReferenceArray<Either<Failure, ?>> results;
    private final AtomicInteger count = new AtomicInteger(0);
    private final Function<List<Either<Failure, ?>>, R> assembler;
    private volatile boolean released = false;

    VariadicContext(int total, Function<List<Either<Failure, ?>>, R> assembler) {
        this.results = new AtomicReferenceArray<>(total);
        this.assembler = assembler;
    }

    Future<R> start(Future<?>... inputs) {
        if (inputs.length != results.length()) {
            throw new IllegalArgumentException(
                "Expected " + results.length() + " futures, got " + inputs.length
            );
        }
        if (inputs.length == 0) {
            complete();
        }
        for (int slot = 0; slot < inputs.length; slot++) {
            try {
                register(slot, inputs[slot]);
            } catch (RuntimeException e) {
                abort(slot);
                throw e;
            }
        }
        return future;
    }

    private <T> void register(int slot, Future<T> input) {
        input.setCallback(result -> {
            results.set(slot, result);
            if (count.incrementAndGet() == results.length()) {
                complete();
            }
        });
        input.close();
    }

    private void complete() {
        final List<Either<Failure, ?>> slots = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            slots.add(results.get(i));
        }
        try {
            promise.setValue(assembler.apply(slots));
        } finally {
            promise.close();
            release();
        }
    }

    // Inputs after the one that failed are left untouched
    private void abort(int slot) {
        LOG.fine(() -> "Join aborted, future " + slot + " rejected its callback");
        try {
            promise.close();
        } finally {
            future.close();
            released = true;
        }
    }

    private void release() {
        released = true;
        LOG.fine(() -> "Join of " + results.length() + " futures completed");
    }

    boolean isReleased() {
        return released;
    }
}
