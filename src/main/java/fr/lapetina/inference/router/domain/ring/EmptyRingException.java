package fr.lapetina.inference.router.domain.ring;

/**
 * Thrown when a key is looked up on a ring with no physical nodes.
 */
public class EmptyRingException extends RuntimeException {

    public EmptyRingException() {
        super("No nodes registered on the ring");
    }
}
