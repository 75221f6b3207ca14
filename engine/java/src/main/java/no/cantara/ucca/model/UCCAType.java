package no.cantara.ucca.model;

public enum UCCAType {
    TEAM("Team"),
    ROLE("Role"),
    CROSS_CONTROLLER("Cross-Controller"),
    ORGANIZATIONAL("Organizational"),
    TEMPORAL("Temporal"),
    TEAM_BASED("Team-Based");

    private final String label;

    UCCAType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static UCCAType fromLabel(String value) {
        return Labels.parse(UCCAType.class, value, UCCAType::label);
    }
}
