package fp.util;

import java.util.Objects;

/**
 * A failure identified only by its code, for errors a producer reports
 * without an exception behind them.
 */
public final class GeneralFailure implements Failure {
    private final String code;

    private GeneralFailure(String code) {
        this.code = Objects.requireNonNull(code, "code");
    }

    public static GeneralFailure of(String code) {
        return new GeneralFailure(code);
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "GeneralFailure(" + code + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof GeneralFailure) {
            return code.equals(((GeneralFailure) other).code);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }
}
