package no.cantara.ucca.model;

/**
 * How team-level (2a) refinements enumerate controller choices.
 */
public enum GenerationMode {
    /** Every combination of authorized controllers. */
    FULL("full"),
    /** One representative combination: the first authorized controller per requirement. */
    REPRESENTATIVE("representative");

    private final String label;

    GenerationMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static GenerationMode fromLabel(String value) {
        return Labels.parse(GenerationMode.class, value, GenerationMode::label);
    }
}
