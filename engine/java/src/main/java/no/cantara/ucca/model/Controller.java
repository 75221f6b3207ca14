package no.cantara.ucca.model;

/**
 * A controller in the control structure. Read-only reference data used for name lookups.
 */
public record Controller(
        String id,
        String name,
        String description
) {
    public Controller(String id, String name) {
        this(id, name, null);
    }
}
