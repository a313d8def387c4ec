package fp.util;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

public final class Left<L, R> extends Either<L, R> {
    private final L value;

    private Left(L value) {
        this.value = value;
    }

    public static <L, R> Either<L, R> of(L value) {
        return new Left<L, R>(value);
    }

    @Override
    public boolean isLeft() {
        return true;
    }

    @Override
    public boolean isRight() {
        return false;
    }

    @Override
    public L left() {
        return value;
    }

    @Override
    public R right() {
        throw new NoSuchElementException("right() called on " + this);
    }

    @Override
    public <T> T fold(Function<L, T> leftFn, Function<R, T> rightFn) {
        return leftFn.apply(value);
    }

    @Override
    public String toString() {
        return "Left(" + value + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Left) {
            final Left<?, ?> left = (Left<?, ?>) other;
            return Objects.equals(value, left.value);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value) * 31 + 1;
    }
}
