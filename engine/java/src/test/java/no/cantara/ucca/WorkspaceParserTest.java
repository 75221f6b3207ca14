package no.cantara.ucca;

import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.AppliesTo;
import no.cantara.ucca.model.AuthorityRelationship;
import no.cantara.ucca.model.GenerationMode;
import no.cantara.ucca.model.GroupOverlapPolicy;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.InterchangeabilityType;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.model.UCCAType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceParserTest {

    private static final Map<String, Object> MINIMAL = Map.of(
            "project", "test-project",
            "controllers", List.of(Map.of("id", "C1", "name", "Pilot")),
            "control_actions", List.of(Map.of("id", "A1", "name", "Deploy")),
            "abstract_uccas", List.of(Map.of(
                    "id", "U1",
                    "code", "UCCA-1",
                    "abstraction_level", "2a",
                    "ucca_type", "Team-Based",
                    "pattern", "Deploy"
            ))
    );

    private static Map<String, Object> minimalWith(String key, Object value) {
        Map<String, Object> m = new HashMap<>(MINIMAL);
        m.put(key, value);
        return m;
    }

    static Path fixture(String name) {
        URL url = WorkspaceParserTest.class.getClassLoader().getResource("fixtures/" + name + "/ucca.yaml");
        assertNotNull(url, "fixture not found: " + name);
        return Paths.get(url.getPath());
    }

    @Test
    void parsesMinimalWorkspace() {
        RefinementWorkspace ws = WorkspaceParser.fromMap(MINIMAL);
        assertEquals("test-project", ws.project());
        assertEquals(1, ws.controllers().size());
        assertEquals("Pilot", ws.controllers().get(0).name());
        assertEquals("Deploy", ws.controlActions().get(0).displayName());

        AbstractUCCA u = ws.abstractUCCAs().get(0);
        assertEquals(AbstractionLevel.TEAM_LEVEL, u.abstractionLevel());
        assertEquals(UCCAType.TEAM_BASED, u.uccaType());
        assertEquals("", u.context());
        assertTrue(u.hazardIds().isEmpty());
    }

    @Test
    void missingConfigUsesDefaults() {
        UCCARefinementConfig config = WorkspaceParser.fromMap(MINIMAL).config();
        assertTrue(config.pruneEquivalent());
        assertFalse(config.includePartialAuthority());
        assertEquals(UCCARefinementConfig.DEFAULT_MAX_COMBINATIONS, config.maxCombinationsPerUCCA());
        assertEquals(GenerationMode.FULL, config.generationMode());
        assertEquals(GroupOverlapPolicy.WARN, config.groupOverlapPolicy());
        assertTrue(config.operatingContext().isUnconstrained());
    }

    @Test
    void parsesConfigSwitches() {
        UCCARefinementConfig config = WorkspaceParser.parseConfig(Map.of(
                "prune_equivalent", false,
                "include_partial_authority", true,
                "max_combinations_per_ucca", 50,
                "generation_mode", "representative",
                "group_overlap_policy", "reject"
        ));
        assertFalse(config.pruneEquivalent());
        assertTrue(config.includePartialAuthority());
        assertEquals(50, config.maxCombinationsPerUCCA());
        assertEquals(GenerationMode.REPRESENTATIVE, config.generationMode());
        assertEquals(GroupOverlapPolicy.REJECT, config.groupOverlapPolicy());
    }

    @Test
    void hasAuthorityDefaultsToTrue() {
        UCCARefinementConfig config = WorkspaceParser.parseConfig(Map.of(
                "authority_relationships", List.of(
                        Map.of("controller_id", "C1", "control_action_id", "A1"),
                        Map.of("controller_id", "C2", "control_action_id", "A1", "has_authority", false)
                )
        ));
        List<AuthorityRelationship> rels = config.authorityRelationships();
        assertTrue(rels.get(0).hasAuthority());
        assertFalse(rels.get(1).hasAuthority());
    }

    @Test
    void enumLabelsAreLenient() {
        UCCARefinementConfig config = WorkspaceParser.parseConfig(Map.of(
                "interchangeable_groups", List.of(Map.of(
                        "id", "G1", "type", "conditional", "controller_ids", List.of("C1", "C2"),
                        "conditions", List.of("mode = cruise"))),
                "special_interactions", List.of(Map.of(
                        "id", "I1", "type", "PROHIBITED", "applies_to", "type1-2",
                        "controller_ids", List.of("C1")))
        ));
        assertEquals(InterchangeabilityType.CONDITIONAL, config.interchangeableGroups().get(0).interchangeabilityType());
        SpecialInteraction interaction = config.specialInteractions().get(0);
        assertEquals(InteractionType.PROHIBITED, interaction.type());
        assertEquals(AppliesTo.TYPE_1_2, interaction.appliesTo());
        assertNull(interaction.priority());
    }

    @Test
    void unknownEnumLabelThrows() {
        Map<String, Object> bad = minimalWith("abstract_uccas", List.of(Map.of(
                "id", "U1", "code", "X", "abstraction_level", "3c", "pattern", "Deploy")));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> WorkspaceParser.fromMap(bad));
        assertTrue(e.getMessage().contains("3c"));
    }

    @Test
    void numericIdsAreReadAsText() {
        RefinementWorkspace ws = WorkspaceParser.fromMap(minimalWith("controllers", List.of(Map.of("id", 7, "name", "Seven"))));
        assertEquals("7", ws.controllers().get(0).id());
    }

    @Test
    void parsesOperatingContext() {
        ConstraintContext ctx = WorkspaceParser.parseContext(Map.of(
                "mode", "approach",
                "time", "08:15",
                "preconditions", List.of("gear-armed")
        ));
        assertEquals("approach", ctx.mode());
        assertEquals(LocalTime.of(8, 15), ctx.time());
        assertEquals(Set.of("gear-armed"), ctx.satisfiedPreconditions());
    }

    @Test
    void unquotedYamlTimeIsRead() {
        String yaml = "project: t\nconfig:\n  operating_context:\n    time: 10:30\n";
        RefinementWorkspace ws = WorkspaceParser.parse(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        assertEquals(LocalTime.of(10, 30), ws.config().operatingContext().time());
    }

    @Test
    void emptyDocumentThrows() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkspaceParser.parse(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void parsesFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("ucca.yaml");
        Files.writeString(file, String.join("\n",
                "project: file-project",
                "controllers:",
                "  - id: C1",
                "    name: Pilot",
                "abstract_uccas:",
                "  - id: U1",
                "    code: UCCA-1",
                "    abstraction_level: 2b",
                "    pattern: \"¬Deploy\"",
                "    controller_ids: [C1]"));
        RefinementWorkspace ws = WorkspaceParser.parse(file);
        assertEquals("file-project", ws.project());
        assertEquals(AbstractionLevel.CONTROLLER_SPECIFIC, ws.abstractUCCAs().get(0).abstractionLevel());
        assertEquals(List.of("C1"), ws.abstractUCCAs().get(0).involvedControllerIds());
    }

    @Test
    void parsesLandingGearFixture() throws IOException {
        RefinementWorkspace ws = WorkspaceParser.parse(fixture("landing-gear"));
        assertEquals("Landing Gear", ws.project());
        assertEquals(3, ws.controllers().size());
        assertEquals(3, ws.controlActions().size());
        assertEquals(5, ws.config().authorityRelationships().size());
        assertEquals(List.of("mode = approach"), ws.config().authorityRelationships().get(2).constraints());
        assertEquals("C1", ws.config().authorityRelationships().get(3).delegatedFrom());
        assertEquals(Set.of("C1", "C3"), ws.config().interchangeableGroups().get(0).controllerIds());
        assertEquals(9, ws.config().specialInteractions().get(0).priority());
        assertEquals(100, ws.config().maxCombinationsPerUCCA());
        assertEquals(4, ws.abstractUCCAs().size());
        assertEquals("¬Deploy ∧ Retract", ws.abstractUCCAs().get(0).abstractPattern());
        assertEquals(Set.of("A1", "A2"), ws.abstractUCCAs().get(0).relevantActions());
    }
}
