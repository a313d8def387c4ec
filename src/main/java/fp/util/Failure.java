package fp.util;

/**
 * An error carried as a value, in the left side of an {@link Either}.
 */
public interface Failure {
    public static <E extends Exception, R> Either<Failure, R> tryCatch(
        SupplierCatch<E, R> process
    ) {
        return ExceptionFailure.tryCatch(process);
    }

    @FunctionalInterface
    public static interface SupplierCatch<E extends Exception, R> {
        R get() throws E;
    }
}
