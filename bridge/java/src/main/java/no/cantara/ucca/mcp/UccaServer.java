package no.cantara.ucca.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.ucca.RefinementReport;
import no.cantara.ucca.RefinementValidator;
import no.cantara.ucca.WorkspaceParser;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.UCCAHierarchy;
import no.cantara.ucca.refine.UCCARefinementEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds and returns a configured MCP server exposing the refinements of a ucca.yaml workspace.
 */
public final class UccaServer {

    private UccaServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Holds the static resource list and per-URI read handlers built from a workspace.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ResourceSet(
        String project,
        List<McpSchema.Resource> resources,
        Map<String, ResourceHandler> handlers,
        List<String> warnings,
        String summary
    ) {}

    @FunctionalInterface
    interface ResourceHandler {
        McpSchema.ReadResourceResult handle(String uri);
    }

    /**
     * Parses, validates and refines the workspace, then builds all resources and their read handlers.
     * Refinement runs once; handlers serve the rendered JSON.
     *
     * @throws IllegalArgumentException if the workspace has validation errors
     */
    static ResourceSet buildResources(Path workspacePath, boolean showPruned) throws IOException {
        RefinementWorkspace workspace = WorkspaceParser.parse(workspacePath);
        RefinementValidator.ValidationResult validation = RefinementValidator.validate(workspace);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid workspace: " + String.join("; ", validation.errors()));
        }

        List<UCCAHierarchy> hierarchies =
            UCCARefinementEngine.forWorkspace(workspace).refineAbstractUCCAs(workspace.abstractUCCAs());
        boolean hidePruned = workspace.config().pruneEquivalent() && !showPruned;

        String slug      = UccaMapper.projectSlug(workspace.project());
        String indexUri  = UccaMapper.indexUri(slug);
        String indexJson = RefinementReport.toJson(workspace.project(), hierarchies, hidePruned);

        List<McpSchema.Resource>     resources = new ArrayList<>();
        Map<String, ResourceHandler> handlers  = new LinkedHashMap<>();
        List<String>                 warnings  = new ArrayList<>(validation.warnings());

        // ── index resource ────────────────────────────────────────────────────────
        resources.add(UccaMapper.buildIndexResource(slug));
        handlers.put(indexUri, uri -> json(uri, indexJson));

        // ── one resource per abstract UCCA ────────────────────────────────────────
        for (UCCAHierarchy hierarchy : hierarchies) {
            String uri = UccaMapper.hierarchyUri(slug, hierarchy.abstractUCCA());
            if (handlers.containsKey(uri)) {
                warnings.add("abstract UCCA '" + hierarchy.abstractUCCA().id()
                    + "': resource " + uri + " already exposed; skipped");
                continue;
            }
            String body = RefinementReport.toJson(hierarchy, hidePruned);
            resources.add(UccaMapper.buildHierarchyResource(slug, hierarchy));
            handlers.put(uri, u -> json(u, body));
        }

        return new ResourceSet(workspace.project(), resources, handlers, List.copyOf(warnings),
            RefinementReport.summary(workspace.project(), hierarchies));
    }

    private static McpSchema.ReadResourceResult json(String uri, String body) {
        return new McpSchema.ReadResourceResult(
            List.of(new McpSchema.TextResourceContents(uri, "application/json", body, null)),
            null
        );
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Refines the workspace at {@code workspacePath} and returns a configured
     * MCP sync server ready to accept connections.
     *
     * @param workspacePath    path to ucca.yaml
     * @param transport        MCP transport provider (e.g. StdioServerTransportProvider)
     * @param showPruned       if true, include refinements flagged as equivalent
     * @param warnOnValidation if true, log validation warnings to stderr
     */
    public static McpSyncServer createServer(
            Path workspacePath,
            McpServerTransportProvider transport,
            boolean showPruned,
            boolean warnOnValidation) throws IOException {

        ResourceSet rs = buildResources(workspacePath, showPruned);
        String slug    = UccaMapper.projectSlug(rs.project());

        if (warnOnValidation) {
            rs.warnings().forEach(w -> System.err.println("[ucca-mcp] ⚠ " + w));
        }
        System.err.println("[ucca-mcp] " + rs.summary());
        System.err.printf("[ucca-mcp] Start with: %s%n", UccaMapper.indexUri(slug));

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("ucca-" + slug, "0.1.0")
            .capabilities(McpSchema.ServerCapabilities.builder()
                .resources(null, null)
                .build())
            .build();

        for (McpSchema.Resource resource : rs.resources()) {
            ResourceHandler handler = rs.handlers().get(resource.uri());
            server.addResource(new McpServerFeatures.SyncResourceSpecification(
                resource,
                (exchange, request) -> handler.handle(request.uri())
            ));
        }

        return server;
    }
}
