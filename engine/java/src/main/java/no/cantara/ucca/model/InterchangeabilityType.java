package no.cantara.ucca.model;

public enum InterchangeabilityType {
    FULL("Full"),
    PARTIAL("Partial"),
    CONDITIONAL("Conditional");

    private final String label;

    InterchangeabilityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static InterchangeabilityType fromLabel(String value) {
        return Labels.parse(InterchangeabilityType.class, value, InterchangeabilityType::label);
    }
}
