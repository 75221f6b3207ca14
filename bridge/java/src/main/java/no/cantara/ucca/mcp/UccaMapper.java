package no.cantara.ucca.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.RefinementStatus;
import no.cantara.ucca.model.UCCAHierarchy;

import java.util.List;
import java.util.Locale;

/**
 * Pure mapping functions: refinement results → MCP schema types.
 * No I/O.
 */
public final class UccaMapper {

    private UccaMapper() {}

    private static final List<McpSchema.Role> AUDIENCE = List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER);

    // ── Slug ──────────────────────────────────────────────────────────────────────

    public static String projectSlug(String project) {
        if (project == null || project.isBlank()) return "ucca";
        String s = project.toLowerCase(Locale.ROOT);
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        return s.isEmpty() ? "ucca" : s;
    }

    // ── URIs ──────────────────────────────────────────────────────────────────────

    public static String indexUri(String slug) {
        return "ucca://" + slug + "/index";
    }

    /** The abstract UCCA's code, or its id when it has none, with characters unsafe in a URI path replaced. */
    public static String hierarchyUri(String slug, AbstractUCCA abstractUCCA) {
        String key = abstractUCCA.code() != null && !abstractUCCA.code().isBlank()
                ? abstractUCCA.code()
                : abstractUCCA.id();
        return "ucca://" + slug + "/" + key.replaceAll("[^A-Za-z0-9._\\-]", "-");
    }

    // ── Priority ──────────────────────────────────────────────────────────────────

    /** 1.0 with high-priority refinements, 0.7 when refined, 0.3 for nothing or a failure. */
    public static double resourcePriority(UCCAHierarchy hierarchy) {
        if (hierarchy.highPriorityCount() > 0) return 1.0;
        if (hierarchy.status() == RefinementStatus.REFINED) return 0.7;
        return 0.3;
    }

    // ── Resource building ─────────────────────────────────────────────────────────

    public static String buildDescription(UCCAHierarchy hierarchy) {
        AbstractUCCA a = hierarchy.abstractUCCA();
        StringBuilder sb = new StringBuilder(a.abstractPattern());
        sb.append("\nStatus: ").append(hierarchy.status());
        sb.append("\nRefined: ").append(hierarchy.totalRefined())
                .append(" (").append(hierarchy.prunedCount()).append(" pruned, ")
                .append(hierarchy.highPriorityCount()).append(" high priority)");
        if (!a.hazardIds().isEmpty()) {
            sb.append("\nHazards: ").append(String.join(", ", a.hazardIds()));
        }
        if (hierarchy.failureReason() != null) {
            sb.append("\nFailure: ").append(hierarchy.failureReason());
        }
        return sb.toString();
    }

    public static McpSchema.Resource buildHierarchyResource(String slug, UCCAHierarchy hierarchy) {
        AbstractUCCA a = hierarchy.abstractUCCA();
        McpSchema.Annotations annotations = new McpSchema.Annotations(AUDIENCE, resourcePriority(hierarchy), null);
        return new McpSchema.Resource(
            hierarchyUri(slug, a),
            a.code() != null ? a.code() : a.id(),
            a.context().isBlank() ? a.abstractPattern() : a.context(),   // title
            buildDescription(hierarchy),
            "application/json",
            null,                    // size
            annotations,
            null                     // meta
        );
    }

    public static McpSchema.Resource buildIndexResource(String slug) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(AUDIENCE, 1.0, null);
        return new McpSchema.Resource(
            indexUri(slug),
            "index",
            "UCCA refinement index",
            "All abstract UCCAs with their refinement status and refined UCCAs",
            "application/json",
            null,
            annotations,
            null
        );
    }
}
