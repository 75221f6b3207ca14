package no.cantara.ucca.refine;

import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCAType;

import java.util.Collection;

/**
 * Applicability of special interactions to a set of controllers and actions.
 */
final class Interactions {

    private Interactions() {}

    /**
     * An interaction applies when its type class matches and its controller and action lists each
     * intersect the given ones. An empty list matches anything; an interaction with both lists
     * empty applies to nothing.
     */
    static boolean applies(SpecialInteraction interaction, UCCAType uccaType,
                           Collection<String> controllerIds, Collection<String> actionIds) {
        if (interaction.isUnscoped()) return false;
        if (!interaction.appliesTo().matches(uccaType)) return false;
        return intersects(interaction.involvedControllerIds(), controllerIds)
                && intersects(interaction.involvedControlActionIds(), actionIds);
    }

    static boolean intersects(Collection<String> declared, Collection<String> present) {
        return declared.isEmpty() || declared.stream().anyMatch(present::contains);
    }

    static boolean within(Collection<String> declared, String id) {
        return declared.isEmpty() || declared.contains(id);
    }
}
