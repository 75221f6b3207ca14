package no.cantara.ucca.model;

/**
 * A control action issued by a controller.
 */
public record ControlAction(
        String id,
        String controllerId,
        String verb,
        String object,
        String name
) {
    public ControlAction(String id, String name) {
        this(id, null, null, null, name);
    }

    /** The name shown in refinement descriptions: {@code name} if set, otherwise "verb object". */
    public String displayName() {
        if (name != null && !name.isBlank()) return name;
        String label = ((verb != null ? verb : "") + " " + (object != null ? object : "")).trim();
        return label.isEmpty() ? id : label;
    }
}
