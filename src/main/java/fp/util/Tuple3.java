package fp.util;

import java.util.Objects;

public final class Tuple3<A, B, C> {
    private final A first;
    private final B second;
    private final C third;

    private Tuple3(A first, B second, C third) {
        this.first = first;
        this.second = second;
        this.third = third;
    }

    public static <A, B, C> Tuple3<A, B, C> of(A first, B second, C third) {
        return new Tuple3<A, B, C>(first, second, third);
    }

    public A getFirst() {
        return first;
    }

    public B getSecond() {
        return second;
    }

    public C getThird() {
        return third;
    }

    @Override
    public String toString() {
        return "Tuple3(" + first + ", " + second + ", " + third + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Tuple3) {
            final Tuple3<?, ?, ?> tuple = (Tuple3<?, ?, ?>) other;
            return Objects.equals(first, tuple.first)
                && Objects.equals(second, tuple.second)
                && Objects.equals(third, tuple.third);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, third);
    }
}
