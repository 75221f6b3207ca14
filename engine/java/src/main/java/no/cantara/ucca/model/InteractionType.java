package no.cantara.ucca.model;

public enum InteractionType {
    MANDATORY("Mandatory"),
    PROHIBITED("Prohibited"),
    PRIORITY("Priority");

    private final String label;

    InteractionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static InteractionType fromLabel(String value) {
        return Labels.parse(InteractionType.class, value, InteractionType::label);
    }
}
