package fp.util;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A value that is either a failure ({@link Left}) or a success
 * ({@link Right}). Instances are immutable.
 *
 * @param <L> the failure type
 * @param <R> the success type
 */
public abstract class Either<L, R> {
    Either() {
    }

    public abstract boolean isLeft();

    public abstract boolean isRight();

    /**
     * @return the failure value
     * @throws java.util.NoSuchElementException if this is a {@link Right}
     */
    public abstract L left();

    /**
     * @return the success value
     * @throws java.util.NoSuchElementException if this is a {@link Left}
     */
    public abstract R right();

    public R get() {
        return right();
    }

    public R orElse(R other) {
        return isRight() ? right() : other;
    }

    public abstract <T> T fold(Function<L, T> leftFn, Function<R, T> rightFn);

    public <R2> Either<L, R2> map(Function<R, R2> fn) {
        return fold(
            failure -> Left.of(failure),
            success -> Right.of(fn.apply(success))
        );
    }

    public <R2> Either<L, R2> flatMap(Function<R, Either<L, R2>> fn) {
        return fold(
            failure -> Left.of(failure),
            fn
        );
    }

    public Either<L, R> forEach(Consumer<R> consumer) {
        if (isRight()) {
            consumer.accept(right());
        }
        return this;
    }

    public Either<L, R> forEachLeft(Consumer<L> consumer) {
        if (isLeft()) {
            consumer.accept(left());
        }
        return this;
    }
}
