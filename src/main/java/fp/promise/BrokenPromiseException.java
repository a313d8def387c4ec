package fp.promise;

/**
 * Delivered as the result of a future whose promise was closed without
 * ever being fulfilled.
 */
public class BrokenPromiseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public BrokenPromiseException() {
        super("Broken promise");
    }
}
