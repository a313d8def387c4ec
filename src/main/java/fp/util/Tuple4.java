package fp.util;

import java.util.Objects;

public final class Tuple4<A, B, C, D> {
    private final A first;
    private final B second;
    private final C third;
    private final D fourth;

    private Tuple4(A first, B second, C third, D fourth) {
        this.first = first;
        this.second = second;
        this.third = third;
        this.fourth = fourth;
    }

    public static <A, B, C, D> Tuple4<A, B, C, D> of(
        A first,
        B second,
        C third,
        D fourth
    ) {
        return new Tuple4<A, B, C, D>(first, second, third, fourth);
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

    public D getFourth() {
        return fourth;
    }

    @Override
    public String toString() {
        return "Tuple4(" + first + ", " + second + ", " + third + ", " + fourth + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Tuple4) {
            final Tuple4<?, ?, ?, ?> tuple = (Tuple4<?, ?, ?, ?>) other;
            return Objects.equals(first, tuple.first)
                && Objects.equals(second, tuple.second)
                && Objects.equals(third, tuple.third)
                && Objects.equals(fourth, tuple.fourth);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, third, fourth);
    }
}
