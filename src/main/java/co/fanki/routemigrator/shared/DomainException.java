package co.fanki.routemigrator.shared;

/**
 * Base exception for violations of the migration model.
 *
 * <p>Thrown when a value object would be built in a state the model
 * forbids, such as a malformed destination path. Recoverable problems
 * found while analyzing a project are never raised as exceptions; they
 * are reported as warnings instead.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when none is given. */
    public static final String MODEL_ERROR = "MODEL_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, MODEL_ERROR);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public DomainException(final String message, final Throwable cause) {
        super(message, cause);
        this.errorCode = MODEL_ERROR;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
