package no.cantara.ucca.refine;

import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.RefinedUCCA;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags refinements that are equivalent once interchangeable controllers are collapsed to their group.
 *
 * <p>The first refinement with a given signature stays unpruned; later ones remain in the list
 * with {@code isPruned=true} so they can still be audited.
 */
public class EquivalenceDeduplicator {

    public static final String PRUNE_REASON = "Equivalent to another combination due to interchangeable controllers";

    private final InterchangeabilityIndex groups;
    private final ConstraintContext context;

    public EquivalenceDeduplicator(InterchangeabilityIndex groups, ConstraintContext context) {
        this.groups = groups;
        this.context = context;
    }

    /** Sorted {@code group-or-controller:action:performed} entries joined with '|'. */
    public String signature(List<ControllerAssignment> assignments) {
        List<String> parts = new ArrayList<>(assignments.size());
        for (ControllerAssignment a : assignments) {
            parts.add(groups.canonicalId(a.controllerId(), context) + ":" + a.controlActionId() + ":" + a.performed());
        }
        parts.sort(null);
        return String.join("|", parts);
    }

    public List<RefinedUCCA> deduplicate(List<RefinedUCCA> refinements) {
        Set<String> seen = new HashSet<>();
        List<RefinedUCCA> result = new ArrayList<>(refinements.size());
        for (RefinedUCCA ucca : refinements) {
            if (seen.add(signature(ucca.specificControllerAssignments()))) {
                result.add(ucca);
            } else {
                result.add(ucca.asPruned(PRUNE_REASON));
            }
        }
        return result;
    }
}
