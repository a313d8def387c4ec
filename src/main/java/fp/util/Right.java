package fp.util;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

public final class Right<L, R> extends Either<L, R> {
    private final R value;

    private Right(R value) {
        this.value = value;
    }

    public static <L, R> Either<L, R> of(R value) {
        return new Right<L, R>(value);
    }

    @Override
    public boolean isLeft() {
        return false;
    }

    @Override
    public boolean isRight() {
        return true;
    }

    @Override
    public L left() {
        throw new NoSuchElementException("left() called on " + this);
    }

    @Override
    public R right() {
        return value;
    }

    @Override
    public <T> T fold(Function<L, T> leftFn, Function<R, T> rightFn) {
        return rightFn.apply(value);
    }

    @Override
    public String toString() {
        return "Right(" + value + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Right) {
            final Right<?, ?> right = (Right<?, ?>) other;
            return Objects.equals(value, right.value);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value) * 31 + 2;
    }
}
