package no.cantara.ucca.refine;

import no.cantara.ucca.WorkspaceParser;
import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.AppliesTo;
import no.cantara.ucca.model.AuthorityRelationship;
import no.cantara.ucca.model.ControlAction;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.GenerationMode;
import no.cantara.ucca.model.GroupOverlapPolicy;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.InterchangeableControllerGroup;
import no.cantara.ucca.model.Priority;
import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.RefinementStatus;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCAHierarchy;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.model.UCCAType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static no.cantara.ucca.model.ControllerAssignment.doesNotProvide;
import static no.cantara.ucca.model.ControllerAssignment.provides;
import static org.junit.jupiter.api.Assertions.*;

class UCCARefinementEngineTest {

    private static final List<Controller> CONTROLLERS = List.of(new Controller("C1", "Pilot"), new Controller("C2", "Autopilot"));
    private static final List<ControlAction> ACTIONS = List.of(new ControlAction("A1", "Deploy"), new ControlAction("A2", "Retract"));

    private static AbstractUCCA ucca(String id, AbstractionLevel level, String pattern, List<String> controllers) {
        return new AbstractUCCA(id, "UCCA-" + id, "", List.of("H1"), UCCAType.TEAM_BASED, level, pattern,
                Set.of("A1", "A2"), controllers, null);
    }

    private static UCCARefinementEngine engine(List<AuthorityRelationship> authority,
                                               List<InterchangeableControllerGroup> groups,
                                               List<SpecialInteraction> interactions) {
        return new UCCARefinementEngine(new UCCARefinementConfig(authority, groups, interactions, true, false),
                CONTROLLERS, ACTIONS);
    }

    private static RefinementWorkspace landingGear() throws IOException {
        URL url = UCCARefinementEngineTest.class.getClassLoader().getResource("fixtures/landing-gear/ucca.yaml");
        assertNotNull(url);
        return WorkspaceParser.parse(Paths.get(url.getPath()));
    }

    private static final List<AuthorityRelationship> BOTH_DEPLOY = List.of(
            AuthorityRelationship.granted("C1", "A1"), AuthorityRelationship.granted("C2", "A1"));

    // ── scenarios ─────────────────────────────────────────────────────────────────

    @Test
    void controllerSpecificNegationAndRequirement() {
        UCCARefinementEngine engine = engine(List.of(
                AuthorityRelationship.granted("C1", "A1"), AuthorityRelationship.granted("C2", "A2")), List.of(), List.of());
        UCCAHierarchy h = engine.refine(ucca("U1", AbstractionLevel.CONTROLLER_SPECIFIC, "¬Deploy ∧ Retract", List.of("C1", "C2")));

        assertEquals(RefinementStatus.REFINED, h.status());
        assertEquals(1, h.refinedUCCAs().size());
        RefinedUCCA r = h.refinedUCCAs().get(0);
        assertEquals(List.of(doesNotProvide("C1", "A1"), provides("C2", "A2")), r.specificControllerAssignments());
        assertEquals("U1-R1", r.id());
        assertEquals("UCCA-U1-R-PIL-AUT", r.code());
        assertEquals("Pilot does not provide Deploy while Autopilot provides Retract", r.description());
        assertEquals(List.of("C1", "C2"), r.involvedControllerIds());
        assertEquals("U1", r.parentAbstractUCCAId());
        assertEquals(List.of("H1"), r.hazardIds());
    }

    @Test
    void wordOperatorsRefineLikeSymbols() {
        UCCARefinementEngine engine = engine(List.of(
                AuthorityRelationship.granted("C1", "A1"), AuthorityRelationship.granted("C2", "A2")), List.of(), List.of());
        UCCAHierarchy symbols = engine.refine(ucca("U1", AbstractionLevel.CONTROLLER_SPECIFIC, "¬Deploy ∧ Retract", List.of("C1", "C2")));
        UCCAHierarchy words = engine.refine(ucca("U1", AbstractionLevel.CONTROLLER_SPECIFIC, "not Deploy and Retract", List.of("C1", "C2")));

        assertEquals(RefinementStatus.REFINED, words.status());
        assertEquals(List.of(doesNotProvide("C1", "A1"), provides("C2", "A2")),
                words.refinedUCCAs().get(0).specificControllerAssignments());
        assertEquals(symbols.refinedUCCAs(), words.refinedUCCAs());
    }

    @Test
    void controllerSpecificKeepsRefinementWhenRequiredActionIsUnprovided() {
        UCCARefinementEngine engine = engine(List.of(AuthorityRelationship.granted("C1", "A1")), List.of(), List.of());
        UCCAHierarchy h = engine.refine(ucca("U1", AbstractionLevel.CONTROLLER_SPECIFIC, "¬Deploy ∧ Retract", List.of("C1")));

        assertEquals(RefinementStatus.REFINED, h.status());
        assertEquals(1, h.refinedUCCAs().size());
        RefinedUCCA r = h.refinedUCCAs().get(0);
        assertEquals(List.of(doesNotProvide("C1", "A1")), r.specificControllerAssignments());
        assertEquals("UCCA-U1-R-PIL", r.code());
        assertEquals("Pilot does not provide Deploy", r.description());
    }

    @Test
    void interchangeableControllersArePrunedNotRemoved() {
        UCCARefinementEngine engine = engine(BOTH_DEPLOY,
                List.of(InterchangeableControllerGroup.full("G1", "crew", List.of("C1", "C2"))), List.of());
        UCCAHierarchy h = engine.refine(ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()));

        assertEquals(2, h.totalRefined());
        assertEquals(1, h.prunedCount());
        assertFalse(h.refinedUCCAs().get(0).isPruned());
        assertEquals(List.of(provides("C1", "A1")), h.refinedUCCAs().get(0).specificControllerAssignments());
        assertTrue(h.refinedUCCAs().get(1).isPruned());
        assertEquals(EquivalenceDeduplicator.PRUNE_REASON, h.refinedUCCAs().get(1).pruneReason());
        assertEquals(1, h.presentable(true).size());
        assertEquals(2, h.presentable(false).size());
    }

    @Test
    void prohibitedCandidatesAreAbsent() {
        SpecialInteraction prohibited = new SpecialInteraction("I1", InteractionType.PROHIBITED, AppliesTo.BOTH,
                List.of("C1", "C2"), List.of("A1"), null, "no double deploy");
        UCCAHierarchy h = engine(BOTH_DEPLOY, List.of(), List.of(prohibited))
                .refine(ucca("U1", AbstractionLevel.CONTROLLER_SPECIFIC, "Deploy", List.of("C1", "C2")));
        assertEquals(RefinementStatus.NO_REFINEMENT, h.status());
        assertTrue(h.refinedUCCAs().isEmpty());
        assertEquals(0, h.prunedCount());
    }

    @Test
    void candidatesWithoutAuthorityNeverSurvive() {
        UCCARefinementEngine engine = new UCCARefinementEngine(
                new UCCARefinementConfig(List.of(AuthorityRelationship.granted("C1", "A2")), List.of(), List.of(), true, false),
                CONTROLLERS, ACTIONS);
        UCCAHierarchy h = engine.refine(ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy ∧ Retract", List.of()));
        assertEquals(RefinementStatus.NO_REFINEMENT, h.status());
    }

    // ── identity and numbering ────────────────────────────────────────────────────

    @Test
    void idsNumberOnlySurvivors() {
        SpecialInteraction prohibited = new SpecialInteraction("I1", InteractionType.PROHIBITED, AppliesTo.BOTH,
                List.of("C1"), List.of("A1"), null, null);
        UCCAHierarchy h = engine(BOTH_DEPLOY, List.of(), List.of(prohibited))
                .refine(ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()));
        assertEquals(1, h.refinedUCCAs().size());
        assertEquals("U1-R1", h.refinedUCCAs().get(0).id());
        assertEquals(List.of("C2"), h.refinedUCCAs().get(0).involvedControllerIds());
    }

    @Test
    void refiningTwiceGivesIdenticalResults() throws IOException {
        RefinementWorkspace ws = landingGear();
        List<UCCAHierarchy> first = UCCARefinementEngine.forWorkspace(ws).refineAbstractUCCAs(ws.abstractUCCAs());
        List<UCCAHierarchy> second = UCCARefinementEngine.forWorkspace(ws).refineAbstractUCCAs(ws.abstractUCCAs());
        assertEquals(first, second);
    }

    // ── landing gear workspace ────────────────────────────────────────────────────

    @Test
    void landingGearWorkspace() throws IOException {
        RefinementWorkspace ws = landingGear();
        List<UCCAHierarchy> hierarchies = UCCARefinementEngine.forWorkspace(ws).refineAbstractUCCAs(ws.abstractUCCAs());
        assertEquals(4, hierarchies.size());

        UCCAHierarchy u1 = hierarchies.get(0);
        assertEquals(RefinementStatus.REFINED, u1.status());
        assertEquals(4, u1.totalRefined());
        assertEquals(2, u1.prunedCount());
        assertEquals(1, u1.highPriorityCount());
        assertEquals(List.of("UCCA-1-R-PIL", "UCCA-1-R-PIL-AUT"),
                u1.presentable(true).stream().map(RefinedUCCA::code).toList());
        RefinedUCCA autopilot = u1.refinedUCCAs().get(1);
        assertEquals(Priority.HIGH, autopilot.priority());
        assertEquals(10, autopilot.priorityScore());
        assertEquals(Priority.MEDIUM, u1.refinedUCCAs().get(0).priority());

        UCCAHierarchy u2 = hierarchies.get(1);
        assertEquals(1, u2.totalRefined());
        assertEquals(List.of(doesNotProvide("C1", "A1"), provides("C1", "A2"), provides("C2", "A2")),
                u2.refinedUCCAs().get(0).specificControllerAssignments());
        assertEquals("Pilot does not provide Deploy while Pilot and Autopilot provide Retract",
                u2.refinedUCCAs().get(0).description());

        assertEquals(RefinementStatus.INVALID_PATTERN, hierarchies.get(2).status());
        assertNotNull(hierarchies.get(2).failureReason());
        assertEquals(RefinementStatus.NO_REFINEMENT, hierarchies.get(3).status());
    }

    @Test
    void everyPerformedAssignmentHasAuthority() throws IOException {
        RefinementWorkspace ws = landingGear();
        AuthorityIndex authority = AuthorityIndex.build(ws.config().authorityRelationships());
        for (UCCAHierarchy h : UCCARefinementEngine.forWorkspace(ws).refineAbstractUCCAs(ws.abstractUCCAs())) {
            for (RefinedUCCA r : h.refinedUCCAs()) {
                for (ControllerAssignment a : r.specificControllerAssignments()) {
                    if (a.performed()) {
                        assertTrue(authority.hasAuthority(a.controllerId(), a.controlActionId()), r.id() + " " + a);
                    }
                }
            }
        }
    }

    @Test
    void operatingContextCanDisableAuthority() throws IOException {
        RefinementWorkspace ws = landingGear();
        // the Autopilot may only retract in approach mode
        UCCARefinementConfig cruise = ws.config().withOperatingContext(new ConstraintContext("cruise", null, null));
        UCCAHierarchy u1 = new UCCARefinementEngine(cruise, ws.controllers(), ws.controlActions())
                .refine(ws.abstractUCCAs().get(0));
        assertEquals(2, u1.totalRefined());
        assertTrue(u1.refinedUCCAs().stream()
                .flatMap(r -> r.specificControllerAssignments().stream())
                .noneMatch(a -> a.controllerId().equals("C2")));
    }

    // ── failures and batch behaviour ──────────────────────────────────────────────

    @Test
    void invalidPatternFailsOnlyThatUcca() {
        List<UCCAHierarchy> hs = engine(BOTH_DEPLOY, List.of(), List.of()).refineAbstractUCCAs(List.of(
                ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy ∨ Retract", List.of()),
                ucca("U2", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of())));
        assertEquals(RefinementStatus.INVALID_PATTERN, hs.get(0).status());
        assertTrue(hs.get(0).failureReason().contains("Unsupported operator"));
        assertEquals(RefinementStatus.REFINED, hs.get(1).status());
    }

    @Test
    void combinationLimitFailsOnlyThatUcca() {
        UCCARefinementConfig config = new UCCARefinementConfig(BOTH_DEPLOY, List.of(), List.of(), true, false)
                .withMaxCombinations(1);
        List<UCCAHierarchy> hs = new UCCARefinementEngine(config, CONTROLLERS, ACTIONS).refineAbstractUCCAs(List.of(
                ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()),
                ucca("U2", AbstractionLevel.CONTROLLER_SPECIFIC, "Deploy", List.of("C1"))));
        assertEquals(RefinementStatus.COMBINATION_LIMIT_EXCEEDED, hs.get(0).status());
        assertTrue(hs.get(0).refinedUCCAs().isEmpty());
        assertTrue(hs.get(0).failureReason().contains("limit is 1"));
        assertEquals(RefinementStatus.REFINED, hs.get(1).status());
    }

    @Test
    void cancellationReturnsCompletedHierarchies() {
        AtomicInteger checks = new AtomicInteger();
        List<UCCAHierarchy> hs = engine(BOTH_DEPLOY, List.of(), List.of()).refineAbstractUCCAs(List.of(
                ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()),
                ucca("U2", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()),
                ucca("U3", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of())),
                () -> checks.incrementAndGet() > 1);
        assertEquals(1, hs.size());
        assertEquals("U1", hs.get(0).abstractUCCA().id());
    }

    @Test
    void representativeModeKeepsOneCandidate() {
        UCCARefinementConfig config = new UCCARefinementConfig(BOTH_DEPLOY, List.of(), List.of(), true, false)
                .withGenerationMode(GenerationMode.REPRESENTATIVE);
        UCCAHierarchy h = new UCCARefinementEngine(config, CONTROLLERS, ACTIONS)
                .refine(ucca("U1", AbstractionLevel.TEAM_LEVEL, "Deploy", List.of()));
        assertEquals(1, h.totalRefined());
        assertEquals(List.of(provides("C1", "A1")), h.refinedUCCAs().get(0).specificControllerAssignments());
    }

    @Test
    void overlappingGroupsAreRejectedUnderRejectPolicy() {
        UCCARefinementConfig config = new UCCARefinementConfig(BOTH_DEPLOY,
                List.of(InterchangeableControllerGroup.full("G1", "a", List.of("C1", "C2")),
                        InterchangeableControllerGroup.full("G2", "b", List.of("C2"))),
                List.of(), true, false, 100, GenerationMode.FULL, GroupOverlapPolicy.REJECT,
                ConstraintContext.UNCONSTRAINED);
        assertThrows(InvalidRefinementConfigException.class, () -> new UCCARefinementEngine(config, CONTROLLERS, ACTIONS));
    }
}
