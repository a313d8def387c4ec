package fp.promise;

public class FutureAlreadyRetrievedException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public FutureAlreadyRetrievedException() {
        super("Future already retrieved");
    }
}
