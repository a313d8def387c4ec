package fp.promise;

/**
 * Thrown when a result or a callback is set a second time on the same
 * future.
 */
public class DoubleSetException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public DoubleSetException(String message) {
        super(message);
    }
}
