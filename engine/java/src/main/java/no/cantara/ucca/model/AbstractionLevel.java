package no.cantara.ucca.model;

public enum AbstractionLevel {
    /** Team-level: the controller set is inferred from authority. */
    TEAM_LEVEL("2a"),
    /** Controller-specific: the controller set is fixed by the abstract UCCA. */
    CONTROLLER_SPECIFIC("2b");

    private final String label;

    AbstractionLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AbstractionLevel fromLabel(String value) {
        return Labels.parse(AbstractionLevel.class, value, AbstractionLevel::label);
    }
}
