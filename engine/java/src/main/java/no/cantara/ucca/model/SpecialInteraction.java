package no.cantara.ucca.model;

import java.util.List;

/**
 * A cross-cutting rule layered on top of authority: mandatory, prohibited or priority-raising.
 *
 * <p>An empty controller or action list leaves that dimension unrestricted.
 *
 * @param priority floor applied by {@code Priority} interactions, or {@code null}
 */
public record SpecialInteraction(
        String id,
        InteractionType type,
        AppliesTo appliesTo,
        List<String> involvedControllerIds,
        List<String> involvedControlActionIds,
        Integer priority,
        String description
) {
    public SpecialInteraction {
        appliesTo = appliesTo != null ? appliesTo : AppliesTo.BOTH;
        involvedControllerIds = involvedControllerIds != null ? List.copyOf(involvedControllerIds) : List.of();
        involvedControlActionIds = involvedControlActionIds != null ? List.copyOf(involvedControlActionIds) : List.of();
    }

    public boolean isUnscoped() {
        return involvedControllerIds.isEmpty() && involvedControlActionIds.isEmpty();
    }
}
