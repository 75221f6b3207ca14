package no.cantara.ucca;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.RefinementStatus;
import no.cantara.ucca.model.UCCAHierarchy;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders refinement results as JSON. Field names are snake_case, matching ucca.yaml.
 */
public final class RefinementReport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private RefinementReport() {}

    /**
     * @param pruneEquivalent if true, refinements flagged as equivalent are left out
     */
    public static String toJson(String project, List<UCCAHierarchy> hierarchies, boolean pruneEquivalent) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("project", project);
        root.put("abstract_ucca_count", hierarchies.size());
        root.put("refined_count", hierarchies.stream().mapToInt(h -> h.presentable(pruneEquivalent).size()).sum());
        root.put("high_priority_count", hierarchies.stream().mapToInt(UCCAHierarchy::highPriorityCount).sum());
        ArrayNode items = root.putArray("hierarchies");
        hierarchies.forEach(h -> items.add(hierarchyNode(h, pruneEquivalent)));
        return write(root);
    }

    /** One-line tally of a run, e.g. {@code "Landing Gear: 4 abstract UCCA(s), 5 refined, ..."}. */
    public static String summary(String project, List<UCCAHierarchy> hierarchies) {
        long failed = hierarchies.stream()
                .filter(h -> h.status() == RefinementStatus.INVALID_PATTERN
                        || h.status() == RefinementStatus.COMBINATION_LIMIT_EXCEEDED)
                .count();
        return String.format("%s: %d abstract UCCA(s), %d refined, %d pruned, %d high priority, %d failed",
                project,
                hierarchies.size(),
                hierarchies.stream().mapToInt(UCCAHierarchy::totalRefined).sum(),
                hierarchies.stream().mapToInt(UCCAHierarchy::prunedCount).sum(),
                hierarchies.stream().mapToInt(UCCAHierarchy::highPriorityCount).sum(),
                failed);
    }

    public static String toJson(UCCAHierarchy hierarchy, boolean pruneEquivalent) {
        return write(hierarchyNode(hierarchy, pruneEquivalent));
    }

    static ObjectNode hierarchyNode(UCCAHierarchy hierarchy, boolean pruneEquivalent) {
        AbstractUCCA a = hierarchy.abstractUCCA();
        ObjectNode node = MAPPER.createObjectNode();
        node.put("abstract_id", a.id());
        node.put("abstract_code", a.code());
        node.put("pattern", a.abstractPattern());
        node.put("abstraction_level", a.abstractionLevel() != null ? a.abstractionLevel().label() : null);
        node.put("status", hierarchy.status().name());
        if (hierarchy.failureReason() != null) {
            node.put("failure_reason", hierarchy.failureReason());
        }
        node.put("total_refined", hierarchy.totalRefined());
        node.put("pruned_count", hierarchy.prunedCount());
        node.put("high_priority_count", hierarchy.highPriorityCount());
        ArrayNode refined = node.putArray("refined");
        hierarchy.presentable(pruneEquivalent).forEach(r -> refined.add(refinedNode(r)));
        return node;
    }

    static ObjectNode refinedNode(RefinedUCCA r) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", r.id());
        node.put("code", r.code());
        node.put("description", r.description());
        node.put("priority", r.priority().label());
        if (r.priorityScore() != null) {
            node.put("priority_score", r.priorityScore());
        }
        node.put("pruned", r.isPruned());
        if (r.pruneReason() != null) {
            node.put("prune_reason", r.pruneReason());
        }
        ArrayNode hazards = node.putArray("hazard_ids");
        r.hazardIds().forEach(hazards::add);
        ArrayNode assignments = node.putArray("assignments");
        for (ControllerAssignment a : r.specificControllerAssignments()) {
            assignments.addObject()
                    .put("controller_id", a.controllerId())
                    .put("control_action_id", a.controlActionId())
                    .put("performed", a.performed());
        }
        return node;
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
