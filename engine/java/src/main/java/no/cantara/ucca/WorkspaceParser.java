package no.cantara.ucca;

import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.AppliesTo;
import no.cantara.ucca.model.AuthorityRelationship;
import no.cantara.ucca.model.ControlAction;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.GenerationMode;
import no.cantara.ucca.model.GroupOverlapPolicy;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.InterchangeabilityType;
import no.cantara.ucca.model.InterchangeableControllerGroup;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.model.UCCAType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Parses a ucca.yaml file into a {@link RefinementWorkspace}.
 */
public class WorkspaceParser {

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static RefinementWorkspace parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static RefinementWorkspace parse(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        if (data == null) {
            throw new IllegalArgumentException("Workspace document is empty");
        }
        return fromMap(data);
    }

    @SuppressWarnings("unchecked")
    public static RefinementWorkspace fromMap(Map<String, Object> data) {
        List<Map<String, Object>> controllerMaps = (List<Map<String, Object>>) data.getOrDefault("controllers", List.of());
        List<Map<String, Object>> actionMaps = (List<Map<String, Object>>) data.getOrDefault("control_actions", List.of());
        Map<String, Object> configMap = (Map<String, Object>) data.getOrDefault("config", Map.of());
        List<Map<String, Object>> uccaMaps = (List<Map<String, Object>>) data.getOrDefault("abstract_uccas", List.of());

        return new RefinementWorkspace(
                string(data.get("project")),
                controllerMaps.stream().map(WorkspaceParser::parseController).toList(),
                actionMaps.stream().map(WorkspaceParser::parseControlAction).toList(),
                parseConfig(configMap),
                uccaMaps.stream().map(WorkspaceParser::parseAbstractUCCA).toList()
        );
    }

    @SuppressWarnings("unchecked")
    static UCCARefinementConfig parseConfig(Map<String, Object> c) {
        List<Map<String, Object>> authority = (List<Map<String, Object>>) c.getOrDefault("authority_relationships", List.of());
        List<Map<String, Object>> groups = (List<Map<String, Object>>) c.getOrDefault("interchangeable_groups", List.of());
        List<Map<String, Object>> interactions = (List<Map<String, Object>>) c.getOrDefault("special_interactions", List.of());
        Object max = c.get("max_combinations_per_ucca");

        return new UCCARefinementConfig(
                authority.stream().map(WorkspaceParser::parseAuthority).toList(),
                groups.stream().map(WorkspaceParser::parseGroup).toList(),
                interactions.stream().map(WorkspaceParser::parseInteraction).toList(),
                bool(c.get("prune_equivalent"), true),
                bool(c.get("include_partial_authority"), false),
                max != null ? ((Number) max).intValue() : UCCARefinementConfig.DEFAULT_MAX_COMBINATIONS,
                GenerationMode.fromLabel(string(c.get("generation_mode"))),
                GroupOverlapPolicy.fromLabel(string(c.get("group_overlap_policy"))),
                parseContext((Map<String, Object>) c.get("operating_context"))
        );
    }

    static ConstraintContext parseContext(Map<String, Object> m) {
        if (m == null) return ConstraintContext.UNCONSTRAINED;
        Object time = m.get("time");
        Object preconditions = m.get("preconditions");
        return new ConstraintContext(
                string(m.get("mode")),
                time != null ? parseTime(time) : null,
                preconditions != null ? new LinkedHashSet<>(strings(preconditions)) : null
        );
    }

    private static Controller parseController(Map<String, Object> m) {
        return new Controller(string(m.get("id")), string(m.get("name")), string(m.get("description")));
    }

    private static ControlAction parseControlAction(Map<String, Object> m) {
        return new ControlAction(
                string(m.get("id")),
                string(m.get("controller_id")),
                string(m.get("verb")),
                string(m.get("object")),
                string(m.get("name"))
        );
    }

    private static AuthorityRelationship parseAuthority(Map<String, Object> m) {
        return new AuthorityRelationship(
                string(m.get("controller_id")),
                string(m.get("control_action_id")),
                bool(m.get("has_authority"), true),
                strings(m.get("constraints")),
                string(m.get("delegated_from"))
        );
    }

    private static InterchangeableControllerGroup parseGroup(Map<String, Object> m) {
        return new InterchangeableControllerGroup(
                string(m.get("id")),
                string(m.get("name")),
                InterchangeabilityType.fromLabel(string(m.get("type"))),
                new LinkedHashSet<>(strings(m.get("controller_ids"))),
                strings(m.get("conditions")),
                strings(m.get("constraints"))
        );
    }

    private static SpecialInteraction parseInteraction(Map<String, Object> m) {
        Object priority = m.get("priority");
        return new SpecialInteraction(
                string(m.get("id")),
                InteractionType.fromLabel(string(m.get("type"))),
                AppliesTo.fromLabel(string(m.get("applies_to"))),
                strings(m.get("controller_ids")),
                strings(m.get("control_action_ids")),
                priority != null ? ((Number) priority).intValue() : null,
                string(m.get("description"))
        );
    }

    private static AbstractUCCA parseAbstractUCCA(Map<String, Object> m) {
        return new AbstractUCCA(
                string(m.get("id")),
                string(m.get("code")),
                string(m.get("context")),
                strings(m.get("hazard_ids")),
                UCCAType.fromLabel(string(m.get("ucca_type"))),
                AbstractionLevel.fromLabel(string(m.get("abstraction_level"))),
                string(m.get("pattern")),
                new LinkedHashSet<>(strings(m.get("relevant_actions"))),
                strings(m.get("controller_ids")),
                string(m.get("temporal_relationship"))
        );
    }

    // YAML reads 2a as a string but 10 or 1.0 as numbers; ids are always treated as text.
    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> strings(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            return list.stream().map(WorkspaceParser::string).toList();
        }
        return List.of(value.toString());
    }

    private static boolean bool(Object value, boolean fallback) {
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        return Boolean.parseBoolean(value.toString());
    }

    private static LocalTime parseTime(Object value) {
        // SnakeYAML resolves unquoted 10:30 as a sexagesimal integer (630)
        if (value instanceof Number n) {
            int minutes = n.intValue();
            return LocalTime.of(minutes / 60, minutes % 60);
        }
        String text = value.toString();
        return text.matches("\\d:\\d{2}") ? LocalTime.parse("0" + text) : LocalTime.parse(text);
    }
}
