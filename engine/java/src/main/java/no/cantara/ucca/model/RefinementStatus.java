package no.cantara.ucca.model;

/**
 * Terminal state of refining one abstract UCCA.
 */
public enum RefinementStatus {
    /** At least one refinement survived filtering. */
    REFINED,
    /** Nothing survived; a valid outcome the caller should surface as a warning. */
    NO_REFINEMENT,
    /** The abstract pattern is outside the supported grammar. */
    INVALID_PATTERN,
    /** The candidate space was larger than the configured bound. */
    COMBINATION_LIMIT_EXCEEDED
}
