package no.cantara.ucca.model;

/**
 * Which UCCA type classes a {@link SpecialInteraction} applies to.
 */
public enum AppliesTo {
    /** Provided / not provided combinations: Team-Based and Cross-Controller UCCAs. */
    TYPE_1_2("Type1-2"),
    /** Temporal combinations. */
    TYPE_3_4("Type3-4"),
    BOTH("Both");

    private final String label;

    AppliesTo(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(UCCAType uccaType) {
        return switch (this) {
            case BOTH -> true;
            case TYPE_1_2 -> uccaType == UCCAType.TEAM_BASED || uccaType == UCCAType.CROSS_CONTROLLER;
            case TYPE_3_4 -> uccaType == UCCAType.TEMPORAL;
        };
    }

    public static AppliesTo fromLabel(String value) {
        return Labels.parse(AppliesTo.class, value, AppliesTo::label);
    }
}
