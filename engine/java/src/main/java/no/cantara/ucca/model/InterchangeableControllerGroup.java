package no.cantara.ucca.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of controllers treated as substitutable when deduplicating refinements.
 */
public record InterchangeableControllerGroup(
        String id,
        String name,
        InterchangeabilityType interchangeabilityType,
        Set<String> controllerIds,
        List<String> conditions,
        List<String> constraints
) {
    public InterchangeableControllerGroup {
        interchangeabilityType = interchangeabilityType != null ? interchangeabilityType : InterchangeabilityType.FULL;
        // insertion order is kept so diagnostics list controllers as declared
        controllerIds = controllerIds != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(controllerIds))
                : Set.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static InterchangeableControllerGroup full(String id, String name, List<String> controllerIds) {
        return new InterchangeableControllerGroup(id, name, InterchangeabilityType.FULL,
                new LinkedHashSet<>(controllerIds), List.of(), List.of());
    }
}
