package no.cantara.ucca.model;

import java.util.List;

/**
 * The root document parsed from ucca.yaml: reference data, rules and the abstract UCCAs to refine.
 */
public record RefinementWorkspace(
        String project,
        List<Controller> controllers,
        List<ControlAction> controlActions,
        UCCARefinementConfig config,
        List<AbstractUCCA> abstractUCCAs
) {
    public RefinementWorkspace {
        controllers = controllers != null ? List.copyOf(controllers) : List.of();
        controlActions = controlActions != null ? List.copyOf(controlActions) : List.of();
        config = config != null ? config : new UCCARefinementConfig(List.of(), List.of(), List.of(), true, false);
        abstractUCCAs = abstractUCCAs != null ? List.copyOf(abstractUCCAs) : List.of();
    }
}
