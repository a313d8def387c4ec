package fp.util;

public class ExceptionFailure implements Failure {
    public final Throwable throwable;

    private ExceptionFailure(Throwable throwable) {
        this.throwable = throwable;
    }

    public static ExceptionFailure of(Throwable throwable) {
        return new ExceptionFailure(throwable);
    }

    public static <E extends Exception, R> Either<Failure, R> tryCatch(
        SupplierCatch<E, R> process
    ) {
        try {
            return Right.of(process.get());
        } catch(Exception e) {
            return Left.of(
                ExceptionFailure.of(e)
            );
        }
    }

    public boolean is(Class<? extends Throwable> type) {
        return type.isInstance(throwable);
    }

    @Override
    public String toString() {
        return "ExceptionFailure(" + throwable.toString() + ")";
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ExceptionFailure) {
            ExceptionFailure failure = (ExceptionFailure) other;
            return failure.toString().equals(this.toString());
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
