package fp.promise;

import java.util.List;
import java.util.function.Consumer;

import fp.util.Either;
import fp.util.Failure;
import fp.util.Left;
import fp.util.Right;
import fp.util.Tuple2;
import fp.util.Tuple3;
import fp.util.Tuple4;

/**
 * Factories for completed futures and combinators that join several futures.
 * <p>
 * The combinators take ownership of their inputs: they set the callback of
 * every input future and close it. The inputs must not have a callback yet.
 * A failed input never aborts a join; its failure is reported in its slot.
 */
public final class Futures {
    private Futures() {
    }

    public static <T> Future<T> of(T value) {
        return ofResult(Right.of(value));
    }

    public static <T> Future<T> failed(Failure failure) {
        return ofResult(Left.of(failure));
    }

    public static <T> Future<T> ofResult(Either<Failure, T> result) {
        final Promise<T> promise = new Promise<T>();
        final Future<T> future = promise.getFuture();
        promise.setResult(result);
        promise.close();
        return future;
    }

    @SuppressWarnings("unchecked")
    public static <A, B> Future<Tuple2<Either<Failure, A>, Either<Failure, B>>> whenAll(
        Future<A> first,
        Future<B> second
    ) {
        return new VariadicContext<Tuple2<Either<Failure, A>, Either<Failure, B>>>(
            2,
            slots -> Tuple2.of(
                (Either<Failure, A>) slots.get(0),
                (Either<Failure, B>) slots.get(1)
            )
        ).start(first, second);
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C> Future<Tuple3<Either<Failure, A>, Either<Failure, B>, Either<Failure, C>>> whenAll(
        Future<A> first,
        Future<B> second,
        Future<C> third
    ) {
        return new VariadicContext<Tuple3<Either<Failure, A>, Either<Failure, B>, Either<Failure, C>>>(
            3,
            slots -> Tuple3.of(
                (Either<Failure, A>) slots.get(0),
                (Either<Failure, B>) slots.get(1),
                (Either<Failure, C>) slots.get(2)
            )
        ).start(first, second, third);
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D> Future<Tuple4<Either<Failure, A>, Either<Failure, B>, Either<Failure, C>, Either<Failure, D>>> whenAll(
        Future<A> first,
        Future<B> second,
        Future<C> third,
        Future<D> fourth
    ) {
        return new VariadicContext<Tuple4<Either<Failure, A>, Either<Failure, B>, Either<Failure, C>, Either<Failure, D>>>(
            4,
            slots -> Tuple4.of(
                (Either<Failure, A>) slots.get(0),
                (Either<Failure, B>) slots.get(1),
                (Either<Failure, C>) slots.get(2),
                (Either<Failure, D>) slots.get(3)
            )
        ).start(first, second, third, fourth);
    }

    /**
     * @return a future of the outcomes of all inputs, in input order; already
     * completed if {@code futures} is empty
     */
    public static <T> Future<List<Either<Failure, T>>> whenAll(List<Future<T>> futures) {
        return new WhenAllContext<T>(futures.size()).start(futures);
    }

    /**
     * Calls {@code callback} once with the outcomes of all inputs, in input
     * order. The callback runs on the thread that completes the last input,
     * or right away if {@code futures} is empty.
     */
    public static <T> void whenAll(
        List<Future<T>> futures,
        Consumer<List<Either<Failure, T>>> callback
    ) {
        new WhenAllLaterContext<T>(futures.size(), callback).start(futures);
    }

    /**
     * @return a future of the index and outcome of the first input to complete
     * @throws IllegalArgumentException if {@code futures} is empty
     */
    public static <T> Future<RaceResult<T>> whenAny(List<Future<T>> futures) {
        return new WhenAnyContext<T>(futures.size()).start(futures);
    }
}
