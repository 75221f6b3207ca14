package no.cantara.ucca.refine;

import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.constraint.ConstraintParser;
import no.cantara.ucca.model.AuthorityRelationship;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.model.UCCAType;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejects candidates that break authority rules or special interactions.
 *
 * <ul>
 *   <li>Every provided action needs a relationship with {@code hasAuthority=true} whose constraints
 *       hold; a missing relationship is tolerated under {@code includePartialAuthority}.</li>
 *   <li>A {@code Prohibited} interaction is violated when the provided assignments inside its scope
 *       cover all of its controllers and all of its actions.</li>
 *   <li>A {@code Mandatory} interaction is satisfied when each of its actions present in the
 *       candidate is provided by one of its controllers.</li>
 * </ul>
 */
public class ConstraintFilter {

    private final AuthorityIndex authority;
    private final List<SpecialInteraction> interactions;
    private final boolean includePartialAuthority;
    private final ConstraintContext context;

    public ConstraintFilter(AuthorityIndex authority, UCCARefinementConfig config) {
        this.authority = authority;
        this.interactions = config.specialInteractions();
        this.includePartialAuthority = config.includePartialAuthority();
        this.context = config.operatingContext();
    }

    public boolean accepts(List<ControllerAssignment> candidate, UCCAType uccaType) {
        return rejectionReason(candidate, uccaType).isEmpty();
    }

    /** Why the candidate is rejected, or empty if it passes. */
    public Optional<String> rejectionReason(List<ControllerAssignment> candidate, UCCAType uccaType) {
        for (ControllerAssignment a : candidate) {
            if (!a.performed()) continue;
            Optional<AuthorityRelationship> rel = authority.lookup(a.controllerId(), a.controlActionId());
            if (rel.isEmpty()) {
                if (!includePartialAuthority) {
                    return Optional.of("no authority declared for " + a.controllerId() + "/" + a.controlActionId());
                }
            } else if (!rel.get().hasAuthority()) {
                return Optional.of(a.controllerId() + " lacks authority for " + a.controlActionId());
            } else if (!ConstraintParser.allHold(rel.get().constraints(), context)) {
                return Optional.of("authority constraints of " + a.controllerId() + "/" + a.controlActionId()
                        + " do not hold");
            }
        }

        Set<String> controllers = candidate.stream().map(ControllerAssignment::controllerId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> actions = candidate.stream().map(ControllerAssignment::controlActionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        for (SpecialInteraction interaction : interactions) {
            if (!Interactions.applies(interaction, uccaType, controllers, actions)) continue;
            if (interaction.type() == InteractionType.MANDATORY && !satisfiesMandatory(interaction, candidate)) {
                return Optional.of("mandatory interaction '" + interaction.id() + "' not satisfied");
            }
            if (interaction.type() == InteractionType.PROHIBITED && violatesProhibited(interaction, candidate)) {
                return Optional.of("prohibited interaction '" + interaction.id() + "' violated");
            }
        }
        return Optional.empty();
    }

    static boolean violatesProhibited(SpecialInteraction interaction, List<ControllerAssignment> candidate) {
        Set<String> coveredControllers = new HashSet<>();
        Set<String> coveredActions = new HashSet<>();
        for (ControllerAssignment a : candidate) {
            if (a.performed()
                    && Interactions.within(interaction.involvedControllerIds(), a.controllerId())
                    && Interactions.within(interaction.involvedControlActionIds(), a.controlActionId())) {
                coveredControllers.add(a.controllerId());
                coveredActions.add(a.controlActionId());
            }
        }
        if (coveredControllers.isEmpty()) return false;
        return coveredControllers.containsAll(interaction.involvedControllerIds())
                && coveredActions.containsAll(interaction.involvedControlActionIds());
    }

    static boolean satisfiesMandatory(SpecialInteraction interaction, List<ControllerAssignment> candidate) {
        Set<String> actionsInScope = candidate.stream()
                .map(ControllerAssignment::controlActionId)
                .filter(id -> Interactions.within(interaction.involvedControlActionIds(), id))
                .collect(Collectors.toSet());
        for (String action : actionsInScope) {
            boolean provided = candidate.stream().anyMatch(a -> a.performed()
                    && a.controlActionId().equals(action)
                    && Interactions.within(interaction.involvedControllerIds(), a.controllerId()));
            if (!provided) return false;
        }
        return true;
    }
}
