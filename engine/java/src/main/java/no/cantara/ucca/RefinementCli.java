package no.cantara.ucca;

import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.RefinementStatus;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.UCCAHierarchy;
import no.cantara.ucca.refine.UCCARefinementEngine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line interface: validates a ucca.yaml workspace and prints its refinements.
 * Usage: java -jar ucca-engine.jar &lt;path-to-ucca.yaml&gt; [--json] [--show-pruned] [--verbose]
 */
public class RefinementCli {

    private static final String USAGE =
            "Usage: java -jar ucca-engine.jar <path-to-ucca.yaml> [--json] [--show-pruned] [--verbose]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path path = null;
        boolean json = false;
        boolean showPruned = false;
        for (String arg : args) {
            switch (arg) {
                case "--json" -> json = true;
                case "--show-pruned" -> showPruned = true;
                case "--verbose" -> enableVerboseLogging();
                default -> {
                    if (!arg.startsWith("-")) path = Path.of(arg);
                }
            }
        }
        if (path == null) {
            err.println(USAGE);
            return 1;
        }
        if (!path.toFile().exists()) {
            err.println("[ucca] Error: file not found: " + path);
            return 1;
        }

        RefinementWorkspace workspace;
        try {
            workspace = WorkspaceParser.parse(path);
        } catch (Exception e) {
            err.println("[ucca] Parse error: " + e.getMessage());
            return 1;
        }

        RefinementValidator.ValidationResult result = RefinementValidator.validate(workspace);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            err.println("[ucca] Validation failed — " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> err.println("  • " + e));
            return 1;
        }

        List<UCCAHierarchy> hierarchies =
                UCCARefinementEngine.forWorkspace(workspace).refineAbstractUCCAs(workspace.abstractUCCAs());
        boolean hidePruned = workspace.config().pruneEquivalent() && !showPruned;

        if (json) {
            out.println(RefinementReport.toJson(workspace.project(), hierarchies, hidePruned));
        } else {
            hierarchies.forEach(h -> printHierarchy(h, hidePruned, out));
        }

        err.println("[ucca] " + RefinementReport.summary(workspace.project(), hierarchies));
        return 0;
    }

    private static void printHierarchy(UCCAHierarchy h, boolean hidePruned, PrintStream out) {
        out.printf("%s  %s  [%s]%n", h.abstractUCCA().code(), h.abstractUCCA().abstractPattern(), h.status());
        if (h.failureReason() != null) {
            out.println("    ! " + h.failureReason());
        }
        if (h.status() == RefinementStatus.NO_REFINEMENT) {
            out.println("    (no valid refinement)");
        }
        for (RefinedUCCA r : h.presentable(hidePruned)) {
            String marker = r.isPruned() ? "~" : "•";
            String priority = r.isPruned() ? "pruned" : r.priority().label() + " " + r.priorityScore();
            out.printf("    %s %-24s %-10s %s%n", marker, r.code(), priority, r.description());
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("no.cantara.ucca");
        root.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }
}
