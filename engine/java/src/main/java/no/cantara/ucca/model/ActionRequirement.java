package no.cantara.ucca.model;

/**
 * One action constraint extracted from an abstract pattern.
 *
 * @param required  {@code true} if the action must be provided, {@code false} if it must not be
 * @param isFromSet {@code true} if the action came from an "any of {...}" selection
 */
public record ActionRequirement(
        String controlActionId,
        boolean required,
        boolean isFromSet
) {
    public static ActionRequirement required(String controlActionId) {
        return new ActionRequirement(controlActionId, true, false);
    }

    public static ActionRequirement negated(String controlActionId) {
        return new ActionRequirement(controlActionId, false, false);
    }

    public static ActionRequirement fromSet(String controlActionId) {
        return new ActionRequirement(controlActionId, true, true);
    }
}
