package no.cantara.ucca.model;

/**
 * What to do when a controller is listed in more than one interchangeable group.
 */
public enum GroupOverlapPolicy {
    /** Log a warning; the group declared last wins. */
    WARN("warn"),
    /** Refuse to build the index. */
    REJECT("reject");

    private final String label;

    GroupOverlapPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static GroupOverlapPolicy fromLabel(String value) {
        return Labels.parse(GroupOverlapPolicy.class, value, GroupOverlapPolicy::label);
    }
}
