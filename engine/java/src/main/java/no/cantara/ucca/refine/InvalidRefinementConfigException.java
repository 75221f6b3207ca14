package no.cantara.ucca.refine;

/**
 * Thrown when refinement rules contradict each other and the configured policy is to reject.
 */
public class InvalidRefinementConfigException extends IllegalArgumentException {
    public InvalidRefinementConfigException(String message) {
        super(message);
    }
}
