package fp.util;

import java.util.Objects;

public final class Tuple2<A, B> {
    private final A first;
    private final B second;

    private Tuple2(A first, B second) {
        this.first = first;
        this.second = second;
    }

    public static <A, B> Tuple2<A, B> of(A first, B second) {
        return new Tuple2<A, B>(first, second);
    }

    public A getFirst() {
        return first;
    }

    public B getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return "Tuple2(" + first + ", " + second + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Tuple2) {
            final Tuple2<?, ?> tuple = (Tuple2<?, ?>) other;
            return Objects.equals(first, tuple.first)
                && Objects.equals(second, tuple.second);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }
}
