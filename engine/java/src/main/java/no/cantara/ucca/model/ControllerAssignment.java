package no.cantara.ucca.model;

/**
 * The atomic unit of a refinement: whether a controller provides a control action.
 */
public record ControllerAssignment(
        String controllerId,
        String controlActionId,
        boolean performed
) {
    public static ControllerAssignment provides(String controllerId, String controlActionId) {
        return new ControllerAssignment(controllerId, controlActionId, true);
    }

    public static ControllerAssignment doesNotProvide(String controllerId, String controlActionId) {
        return new ControllerAssignment(controllerId, controlActionId, false);
    }
}
