package nibbler;

/**
 * Base class of all errors that are specific to the decomposition and generation process
 */
public class NibblerError extends RuntimeException {

    public NibblerError(String message) {
        super(message);
    }

    public NibblerError(String message, Throwable cause) {
        super(message, cause);
    }
}
