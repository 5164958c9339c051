package factstore.core.triple;

/**
 * Raised when a primitive or a query clause cannot be turned into a triple slot.
 * Always thrown at construction time, never deferred to matching.
 */
public class TripleFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public TripleFormatException(String message) {
        super(message);
    }
}
