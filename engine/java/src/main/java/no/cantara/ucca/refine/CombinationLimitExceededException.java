package no.cantara.ucca.refine;

/**
 * Thrown when the candidate space of a single abstract UCCA exceeds the configured bound.
 * Only that UCCA fails; a batch continues with the remaining ones.
 */
public class CombinationLimitExceededException extends Exception {

    private final String abstractUCCAId;
    private final long candidateCount;
    private final int limit;

    public CombinationLimitExceededException(String abstractUCCAId, long candidateCount, int limit) {
        super("Abstract UCCA '" + abstractUCCAId + "' would generate "
                + (candidateCount == Long.MAX_VALUE ? "more than " + Long.MAX_VALUE : String.valueOf(candidateCount))
                + " candidates; limit is " + limit);
        this.abstractUCCAId = abstractUCCAId;
        this.candidateCount = candidateCount;
        this.limit = limit;
    }

    public String abstractUCCAId() {
        return abstractUCCAId;
    }

    public long candidateCount() {
        return candidateCount;
    }

    public int limit() {
        return limit;
    }
}
