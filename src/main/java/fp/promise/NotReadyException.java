package fp.promise;

/**
 * Thrown when a result is read before one has been committed.
 */
public class NotReadyException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public NotReadyException() {
        super("Result is not ready");
    }
}
