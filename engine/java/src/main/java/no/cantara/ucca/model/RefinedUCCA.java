package no.cantara.ucca.model;

import java.util.List;

/**
 * A concrete, controller-bound instantiation of an {@link AbstractUCCA}.
 *
 * <p>Records are immutable: the pipeline derives scored and pruned copies through
 * {@link #withPriority(Priority, int)} and {@link #asPruned(String)}.
 */
public record RefinedUCCA(
        String id,
        String code,
        String description,
        String context,
        List<String> hazardIds,
        UCCAType uccaType,
        List<String> involvedControllerIds,
        String parentAbstractUCCAId,
        List<ControllerAssignment> specificControllerAssignments,
        Priority priority,
        Integer priorityScore,
        boolean isPruned,
        String pruneReason,
        String temporalRelationship
) {
    public RefinedUCCA {
        hazardIds = hazardIds != null ? List.copyOf(hazardIds) : List.of();
        involvedControllerIds = involvedControllerIds != null ? List.copyOf(involvedControllerIds) : List.of();
        specificControllerAssignments = specificControllerAssignments != null
                ? List.copyOf(specificControllerAssignments) : List.of();
        priority = priority != null ? priority : Priority.MEDIUM;
    }

    public RefinedUCCA withPriority(Priority newPriority, int score) {
        return new RefinedUCCA(id, code, description, context, hazardIds, uccaType, involvedControllerIds,
                parentAbstractUCCAId, specificControllerAssignments, newPriority, score, isPruned, pruneReason,
                temporalRelationship);
    }

    public RefinedUCCA asPruned(String reason) {
        return new RefinedUCCA(id, code, description, context, hazardIds, uccaType, involvedControllerIds,
                parentAbstractUCCAId, specificControllerAssignments, priority, priorityScore, true, reason,
                temporalRelationship);
    }
}
