package fp.promise;

import java.util.Objects;

import fp.util.Either;
import fp.util.Failure;

/**
 * The outcome of the first future to complete in a race, with its position
 * in the raced list.
 */
public class RaceResult<T> {
    private final int index;
    private final Either<Failure, T> result;

    public RaceResult(
        final int index,
        final Either<Failure, T> result
    ) {
        this.index = index;
        this.result = result;
    }

    public int getIndex() {
        return index;
    }

    public Either<Failure, T> getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "RaceResult(" + index + ", " + result + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof RaceResult) {
            final RaceResult<?> raceResult = (RaceResult<?>) other;
            return index == raceResult.index
                && Objects.equals(result, raceResult.result);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return index * 31 + Objects.hashCode(result);
    }
}
