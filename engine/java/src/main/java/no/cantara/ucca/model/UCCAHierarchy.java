package no.cantara.ucca.model;

import java.util.List;

/**
 * The refinements produced for one abstract UCCA.
 *
 * @param totalRefined      number of refinements that passed the constraint filter, pruned ones included
 * @param prunedCount       number flagged as equivalent to an earlier refinement
 * @param highPriorityCount number of unpruned refinements classified {@link Priority#HIGH}
 * @param failureReason     detail for {@code INVALID_PATTERN} and {@code COMBINATION_LIMIT_EXCEEDED}, else {@code null}
 */
public record UCCAHierarchy(
        AbstractUCCA abstractUCCA,
        List<RefinedUCCA> refinedUCCAs,
        int totalRefined,
        int prunedCount,
        int highPriorityCount,
        RefinementStatus status,
        String failureReason
) {
    public UCCAHierarchy {
        refinedUCCAs = refinedUCCAs != null ? List.copyOf(refinedUCCAs) : List.of();
    }

    public static UCCAHierarchy failed(AbstractUCCA abstractUCCA, RefinementStatus status, String reason) {
        return new UCCAHierarchy(abstractUCCA, List.of(), 0, 0, 0, status, reason);
    }

    /**
     * The refinements a caller should show: all of them, or only the unpruned ones when
     * {@code pruneEquivalent} is set.
     */
    public List<RefinedUCCA> presentable(boolean pruneEquivalent) {
        if (!pruneEquivalent) return refinedUCCAs;
        return refinedUCCAs.stream().filter(r -> !r.isPruned()).toList();
    }
}
