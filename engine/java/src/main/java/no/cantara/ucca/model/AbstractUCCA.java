package no.cantara.ucca.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An unsafe-combination pattern over control actions, not yet bound to specific controllers.
 * Produced by the upstream enumerators; the engine never modifies it.
 *
 * @param abstractPattern e.g. {@code "¬Deploy ∧ Retract"} or {@code "Deploy ∧ any of {Brake, Reverse}"}
 */
public record AbstractUCCA(
        String id,
        String code,
        String context,
        List<String> hazardIds,
        UCCAType uccaType,
        AbstractionLevel abstractionLevel,
        String abstractPattern,
        Set<String> relevantActions,
        List<String> involvedControllerIds,
        String temporalRelationship
) {
    public AbstractUCCA {
        context = context != null ? context : "";
        hazardIds = hazardIds != null ? List.copyOf(hazardIds) : List.of();
        abstractPattern = abstractPattern != null ? abstractPattern : "";
        relevantActions = relevantActions != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(relevantActions))
                : Set.of();
        involvedControllerIds = involvedControllerIds != null ? List.copyOf(involvedControllerIds) : List.of();
    }
}
