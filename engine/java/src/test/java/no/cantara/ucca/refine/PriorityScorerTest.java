package no.cantara.ucca.refine;

import no.cantara.ucca.model.AppliesTo;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.Priority;
import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCAType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static no.cantara.ucca.model.ControllerAssignment.provides;
import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {

    private static RefinedUCCA refined(UCCAType type, List<String> hazards, List<String> controllers) {
        return new RefinedUCCA("U1-R1", "UCCA-1-R-PIL", "", "", hazards, type, controllers, "U1",
                controllers.stream().map(c -> provides(c, "A1")).toList(), null, null, false, null, null);
    }

    private static SpecialInteraction priority(Integer value, AppliesTo appliesTo, List<String> controllers) {
        return new SpecialInteraction("P1", InteractionType.PRIORITY, appliesTo, controllers, List.of(), value, null);
    }

    @Test
    void plainRefinementScoresBaseline() {
        RefinedUCCA r = new PriorityScorer(List.of()).prioritize(refined(UCCAType.TEAM_BASED, List.of("H1"), List.of("C1")));
        assertEquals(Priority.MEDIUM, r.priority());
        assertEquals(5, r.priorityScore());
    }

    @Test
    void structuralBonusesAccumulate() {
        PriorityScorer scorer = new PriorityScorer(List.of());
        assertEquals(6, scorer.score(refined(UCCAType.TEAM_BASED, List.of("H1", "H2"), List.of("C1"))));
        assertEquals(6, scorer.score(refined(UCCAType.TEAM_BASED, List.of(), List.of("C1", "C2", "C3", "C4"))));
        assertEquals(6, scorer.score(refined(UCCAType.TEMPORAL, List.of(), List.of("C1"))));
        RefinedUCCA all = scorer.prioritize(refined(UCCAType.TEMPORAL, List.of("H1", "H2"), List.of("C1", "C2", "C3", "C4")));
        assertEquals(8, all.priorityScore());
        assertEquals(Priority.HIGH, all.priority());
    }

    @Test
    void matchingPriorityInteractionRaisesTheFloor() {
        PriorityScorer scorer = new PriorityScorer(List.of(priority(9, AppliesTo.BOTH, List.of("C1"))));
        RefinedUCCA r = scorer.prioritize(refined(UCCAType.TEAM_BASED, List.of(), List.of("C1")));
        assertEquals(9, r.priorityScore());
        assertEquals(Priority.HIGH, r.priority());
        assertEquals(5, scorer.score(refined(UCCAType.TEAM_BASED, List.of(), List.of("C2"))));
    }

    @Test
    void addingAPriorityInteractionNeverLowersTheScore() {
        RefinedUCCA r = refined(UCCAType.TEMPORAL, List.of("H1", "H2"), List.of("C1"));
        int without = new PriorityScorer(List.of()).score(r);
        assertTrue(new PriorityScorer(List.of(priority(9, AppliesTo.BOTH, List.of("C1")))).score(r) >= without);
        assertEquals(without, new PriorityScorer(List.of(priority(2, AppliesTo.BOTH, List.of("C1")))).score(r));
    }

    @Test
    void interactionWithoutPriorityUsesBaseline() {
        assertEquals(5, new PriorityScorer(List.of(priority(null, AppliesTo.BOTH, List.of("C1"))))
                .score(refined(UCCAType.TEAM_BASED, List.of(), List.of("C1"))));
    }

    @Test
    void appliesToIsRespected() {
        PriorityScorer scorer = new PriorityScorer(List.of(priority(9, AppliesTo.TYPE_3_4, List.of("C1"))));
        assertEquals(5, scorer.score(refined(UCCAType.CROSS_CONTROLLER, List.of(), List.of("C1"))));
        assertEquals(10, scorer.score(refined(UCCAType.TEMPORAL, List.of(), List.of("C1"))));
    }

    @Test
    void nonPriorityInteractionsAreIgnored() {
        SpecialInteraction prohibited = new SpecialInteraction("X", InteractionType.PROHIBITED, AppliesTo.BOTH,
                List.of("C1"), List.of(), 10, null);
        assertEquals(5, new PriorityScorer(List.of(prohibited)).score(refined(UCCAType.TEAM_BASED, List.of(), List.of("C1"))));
    }

    @Test
    void classifyThresholds() {
        assertEquals(Priority.HIGH, PriorityScorer.classify(8));
        assertEquals(Priority.MEDIUM, PriorityScorer.classify(7));
        assertEquals(Priority.MEDIUM, PriorityScorer.classify(5));
        assertEquals(Priority.LOW, PriorityScorer.classify(4));
    }

    @Test
    void prunedRefinementsAreNotScored() {
        RefinedUCCA pruned = refined(UCCAType.TEAM_BASED, List.of(), List.of("C1")).asPruned("dup");
        assertSame(pruned, new PriorityScorer(List.of()).prioritize(pruned));
        assertNull(pruned.priorityScore());
    }
}
