package no.cantara.ucca.refine;

import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.Priority;
import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCAType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores refinements. Starts at 5, raised to the floor of every matching {@code Priority}
 * interaction, then +1 each for more than three controllers, more than one hazard and a
 * temporal UCCA type. 8 and above is High, 5 and above Medium, anything lower Low.
 */
public class PriorityScorer {

    static final int BASELINE = 5;
    static final int HIGH_THRESHOLD = 8;
    static final int MEDIUM_THRESHOLD = 5;

    private final List<SpecialInteraction> priorityInteractions;

    public PriorityScorer(List<SpecialInteraction> interactions) {
        this.priorityInteractions = interactions.stream()
                .filter(i -> i.type() == InteractionType.PRIORITY)
                .toList();
    }

    public int score(RefinedUCCA ucca) {
        int score = BASELINE;

        Set<String> actions = ucca.specificControllerAssignments().stream()
                .map(ControllerAssignment::controlActionId)
                .collect(Collectors.toSet());
        for (SpecialInteraction interaction : priorityInteractions) {
            if (Interactions.applies(interaction, ucca.uccaType(), ucca.involvedControllerIds(), actions)) {
                score = Math.max(score, interaction.priority() != null ? interaction.priority() : BASELINE);
            }
        }

        if (new HashSet<>(ucca.involvedControllerIds()).size() > 3) score++;
        if (ucca.hazardIds().size() > 1) score++;
        if (ucca.uccaType() == UCCAType.TEMPORAL) score++;
        return score;
    }

    public static Priority classify(int score) {
        if (score >= HIGH_THRESHOLD) return Priority.HIGH;
        if (score >= MEDIUM_THRESHOLD) return Priority.MEDIUM;
        return Priority.LOW;
    }

    /** Scores an unpruned refinement; pruned ones are returned unchanged. */
    public RefinedUCCA prioritize(RefinedUCCA ucca) {
        if (ucca.isPruned()) return ucca;
        int score = score(ucca);
        return ucca.withPriority(classify(score), score);
    }
}
