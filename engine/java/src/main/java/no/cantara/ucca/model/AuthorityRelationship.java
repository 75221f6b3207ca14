package no.cantara.ucca.model;

import java.util.List;

/**
 * Declares whether a controller may legitimately perform a control action.
 *
 * @param constraints   free-text constraints; see {@link no.cantara.ucca.constraint.ConstraintParser}
 * @param delegatedFrom controller the authority was delegated from, or {@code null}
 */
public record AuthorityRelationship(
        String controllerId,
        String controlActionId,
        boolean hasAuthority,
        List<String> constraints,
        String delegatedFrom
) {
    public AuthorityRelationship {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static AuthorityRelationship granted(String controllerId, String controlActionId) {
        return new AuthorityRelationship(controllerId, controlActionId, true, List.of(), null);
    }

    public static AuthorityRelationship denied(String controllerId, String controlActionId) {
        return new AuthorityRelationship(controllerId, controlActionId, false, List.of(), null);
    }
}
