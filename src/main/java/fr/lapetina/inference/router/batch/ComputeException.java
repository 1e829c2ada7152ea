package fr.lapetina.inference.router.batch;

/**
 * Raised by a {@link ComputeEngine} when a batch cannot be executed.
 */
public class ComputeException extends Exception {

    public ComputeException(String message) {
        super(message);
    }

    public ComputeException(String message, Throwable cause) {
        super(message, cause);
    }
}
