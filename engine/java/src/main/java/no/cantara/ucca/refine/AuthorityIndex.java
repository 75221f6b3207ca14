package no.cantara.ucca.refine;

import no.cantara.ucca.model.AuthorityRelationship;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lookup from (controller, control action) to its {@link AuthorityRelationship}.
 *
 * <p>When the same pair is declared twice the later declaration wins, keeping the position of
 * the first in {@link #authorizedControllers(String)} ordering.
 */
public final class AuthorityIndex {

    private static final Logger logger = Logger.getLogger(AuthorityIndex.class.getName());

    private final Map<Key, AuthorityRelationship> relationships;
    private final Map<String, List<String>> authorizedByAction;

    private record Key(String controllerId, String controlActionId) {}

    private AuthorityIndex(Map<Key, AuthorityRelationship> relationships) {
        this.relationships = relationships;
        Map<String, List<String>> authorized = new LinkedHashMap<>();
        for (AuthorityRelationship rel : relationships.values()) {
            if (rel.hasAuthority()) {
                authorized.computeIfAbsent(rel.controlActionId(), k -> new ArrayList<>()).add(rel.controllerId());
            }
        }
        authorized.replaceAll((k, v) -> List.copyOf(v));
        this.authorizedByAction = authorized;
    }

    public static AuthorityIndex build(List<AuthorityRelationship> relationships) {
        Map<Key, AuthorityRelationship> map = new LinkedHashMap<>();
        for (AuthorityRelationship rel : relationships) {
            AuthorityRelationship previous = map.put(new Key(rel.controllerId(), rel.controlActionId()), rel);
            if (previous != null) {
                logger.fine(() -> "Authority for " + rel.controllerId() + "/" + rel.controlActionId()
                        + " declared more than once; last declaration wins");
            }
        }
        return new AuthorityIndex(map);
    }

    public Optional<AuthorityRelationship> lookup(String controllerId, String controlActionId) {
        return Optional.ofNullable(relationships.get(new Key(controllerId, controlActionId)));
    }

    public boolean hasAuthority(String controllerId, String controlActionId) {
        return lookup(controllerId, controlActionId).map(AuthorityRelationship::hasAuthority).orElse(false);
    }

    public boolean isDeclared(String controllerId, String controlActionId) {
        return relationships.containsKey(new Key(controllerId, controlActionId));
    }

    /** Controllers with affirmative authority over the action, in declaration order. */
    public List<String> authorizedControllers(String controlActionId) {
        return authorizedByAction.getOrDefault(controlActionId, List.of());
    }

    public int size() {
        return relationships.size();
    }
}
