package no.cantara.ucca.refine;

import no.cantara.ucca.model.ControlAction;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.ControllerAssignment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the code and the human-readable description of a refinement.
 */
public class RefinementDescriber {

    private final Map<String, Controller> controllers = new HashMap<>();
    private final Map<String, ControlAction> actions = new HashMap<>();

    public RefinementDescriber(List<Controller> controllers, List<ControlAction> controlActions) {
        controllers.forEach(c -> this.controllers.putIfAbsent(c.id(), c));
        controlActions.forEach(a -> this.actions.putIfAbsent(a.id(), a));
    }

    /** {@code <parentCode>-R-<ABB>-<ABB>...}, one abbreviation per distinct controller in order of appearance. */
    public String code(String parentCode, List<ControllerAssignment> assignments) {
        Set<String> controllerIds = new LinkedHashSet<>();
        assignments.forEach(a -> controllerIds.add(a.controllerId()));
        String abbreviations = controllerIds.stream().map(this::abbreviation).collect(Collectors.joining("-"));
        return parentCode + "-R-" + abbreviations;
    }

    /**
     * E.g. "Pilot provides Retract while Autopilot does not provide Deploy during approach".
     */
    public String description(List<ControllerAssignment> assignments, String context) {
        Map<String, List<ControllerAssignment>> byAction = new LinkedHashMap<>();
        for (ControllerAssignment a : assignments) {
            byAction.computeIfAbsent(a.controlActionId(), k -> new ArrayList<>()).add(a);
        }

        List<String> parts = new ArrayList<>();
        byAction.forEach((actionId, group) -> {
            ControlAction action = actions.get(actionId);
            String actionName = action != null ? action.displayName() : "unknown action";

            List<String> performers = group.stream().filter(ControllerAssignment::performed)
                    .map(a -> controllerName(a.controllerId())).toList();
            List<String> nonPerformers = group.stream().filter(a -> !a.performed())
                    .map(a -> controllerName(a.controllerId())).toList();

            if (!performers.isEmpty()) {
                parts.add(String.join(" and ", performers)
                        + (performers.size() == 1 ? " provides " : " provide ") + actionName);
            }
            if (!nonPerformers.isEmpty()) {
                parts.add(String.join(" and ", nonPerformers)
                        + (nonPerformers.size() == 1 ? " does not provide " : " do not provide ") + actionName);
            }
        });

        String description = String.join(" while ", parts);
        return context == null || context.isBlank() ? description : description + " " + context;
    }

    String abbreviation(String controllerId) {
        Controller controller = controllers.get(controllerId);
        if (controller == null || controller.name() == null || controller.name().isBlank()) return "UNK";
        String name = controller.name();
        return name.substring(0, Math.min(3, name.length())).toUpperCase(Locale.ROOT);
    }

    String controllerName(String controllerId) {
        Controller controller = controllers.get(controllerId);
        return controller != null && controller.name() != null ? controller.name() : "Unknown";
    }
}
