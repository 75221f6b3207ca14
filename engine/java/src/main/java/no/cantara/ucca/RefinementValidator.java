package no.cantara.ucca;

import no.cantara.ucca.constraint.ConstraintExpression;
import no.cantara.ucca.constraint.ConstraintParser;
import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.AuthorityRelationship;
import no.cantara.ucca.model.ControlAction;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.GroupOverlapPolicy;
import no.cantara.ucca.model.InteractionType;
import no.cantara.ucca.model.InterchangeableControllerGroup;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.SpecialInteraction;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.pattern.PatternParser;
import no.cantara.ucca.pattern.PatternSyntaxException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a parsed {@link RefinementWorkspace} before refinement.
 *
 * <p>Returns a {@link ValidationResult} with separate {@code errors} (refinement would be
 * meaningless or refused) and {@code warnings} (refinement runs, but some input is ignored or
 * resolved by last-write-wins).
 */
public class RefinementValidator {

    private static final int MIN_PRIORITY = 0;
    private static final int MAX_PRIORITY = 10;

    /**
     * Immutable result of validating a workspace.
     *
     * @param errors   Conditions that make the workspace invalid (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(RefinementWorkspace workspace) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> controllerIds = workspace.controllers().stream().map(Controller::id).collect(Collectors.toSet());
        Set<String> actionIds = workspace.controlActions().stream().map(ControlAction::id).collect(Collectors.toSet());

        validateReferenceData(workspace, errors, warnings);

        UCCARefinementConfig config = workspace.config();
        if (config.maxCombinationsPerUCCA() <= 0) {
            errors.add("config: 'max_combinations_per_ucca' must be positive, got " + config.maxCombinationsPerUCCA());
        }

        validateAuthority(config.authorityRelationships(), controllerIds, actionIds, warnings);
        validateGroups(config, controllerIds, errors, warnings);
        validateInteractions(config.specialInteractions(), controllerIds, actionIds, errors, warnings);
        validateAbstractUCCAs(workspace.abstractUCCAs(), controllerIds, actionIds, errors, warnings);

        return new ValidationResult(errors, warnings);
    }

    private static void validateReferenceData(RefinementWorkspace workspace, List<String> errors, List<String> warnings) {
        Set<String> seen = new HashSet<>();
        for (Controller c : workspace.controllers()) {
            if (c.id() == null || c.id().isBlank()) {
                errors.add("controller: 'id' is required");
            } else if (!seen.add(c.id())) {
                warnings.add("controller '" + c.id() + "': duplicate 'id' (first occurrence takes precedence)");
            }
            if (c.id() != null && (c.name() == null || c.name().isBlank())) {
                warnings.add("controller '" + c.id() + "': no 'name'; refinement codes will use UNK");
            }
        }
        seen.clear();
        for (ControlAction a : workspace.controlActions()) {
            if (a.id() == null || a.id().isBlank()) {
                errors.add("control action: 'id' is required");
            } else if (!seen.add(a.id())) {
                warnings.add("control action '" + a.id() + "': duplicate 'id' (first occurrence takes precedence)");
            }
        }
    }

    private static void validateAuthority(List<AuthorityRelationship> relationships,
                                          Set<String> controllerIds, Set<String> actionIds,
                                          List<String> warnings) {
        Map<String, AuthorityRelationship> byPair = new HashMap<>();
        for (AuthorityRelationship rel : relationships) {
            String p = "authority '" + rel.controllerId() + "' -> '" + rel.controlActionId() + "'";
            if (byPair.put(rel.controllerId() + "\u0000" + rel.controlActionId(), rel) != null) {
                warnings.add(p + ": declared more than once (last declaration takes precedence)");
            }
            if (!controllerIds.contains(rel.controllerId())) {
                warnings.add(p + ": unknown controller '" + rel.controllerId() + "'");
            }
            if (!actionIds.contains(rel.controlActionId())) {
                warnings.add(p + ": unknown control action '" + rel.controlActionId() + "'");
            }
            for (ConstraintExpression constraint : ConstraintParser.parseAll(rel.constraints())) {
                if (constraint instanceof ConstraintExpression.Unparsed u) {
                    warnings.add(p + ": constraint '" + u.source() + "' is not recognised and always holds");
                }
            }
        }
        for (AuthorityRelationship rel : relationships) {
            if (rel.delegatedFrom() == null) continue;
            AuthorityRelationship source = byPair.get(rel.delegatedFrom() + "\u0000" + rel.controlActionId());
            if (source == null || !source.hasAuthority()) {
                warnings.add("authority '" + rel.controllerId() + "' -> '" + rel.controlActionId()
                        + "': delegated from '" + rel.delegatedFrom() + "', which holds no authority for it");
            }
        }
    }

    private static void validateGroups(UCCARefinementConfig config, Set<String> controllerIds,
                                       List<String> errors, List<String> warnings) {
        Map<String, String> groupOf = new HashMap<>();
        for (InterchangeableControllerGroup group : config.interchangeableGroups()) {
            String p = "group '" + group.id() + "'";
            if (group.id() == null || group.id().isBlank()) {
                errors.add("group: 'id' is required");
                continue;
            }
            if (group.controllerIds().size() < 2) {
                warnings.add(p + ": fewer than two controllers; nothing to interchange");
            }
            for (String controllerId : group.controllerIds()) {
                if (!controllerIds.contains(controllerId)) {
                    warnings.add(p + ": unknown controller '" + controllerId + "'");
                }
                String previous = groupOf.put(controllerId, group.id());
                if (previous != null && !previous.equals(group.id())) {
                    String msg = "controller '" + controllerId + "' is in groups '" + previous + "' and '" + group.id() + "'";
                    if (config.groupOverlapPolicy() == GroupOverlapPolicy.REJECT) {
                        errors.add(msg);
                    } else {
                        warnings.add(msg + " (last group takes precedence)");
                    }
                }
            }
        }
    }

    private static void validateInteractions(List<SpecialInteraction> interactions,
                                             Set<String> controllerIds, Set<String> actionIds,
                                             List<String> errors, List<String> warnings) {
        for (SpecialInteraction interaction : interactions) {
            String p = "interaction '" + interaction.id() + "'";
            if (interaction.type() == null) {
                errors.add(p + ": 'type' is required");
                continue;
            }
            if (interaction.isUnscoped()) {
                warnings.add(p + ": no controllers or control actions; it never applies");
            }
            if (interaction.type() == InteractionType.PRIORITY) {
                if (interaction.priority() == null) {
                    warnings.add(p + ": Priority interaction without 'priority'; 5 is used");
                } else if (interaction.priority() < MIN_PRIORITY || interaction.priority() > MAX_PRIORITY) {
                    warnings.add(p + ": 'priority' " + interaction.priority() + " is outside "
                            + MIN_PRIORITY + "-" + MAX_PRIORITY);
                }
            }
            interaction.involvedControllerIds().stream()
                    .filter(id -> !controllerIds.contains(id))
                    .forEach(id -> warnings.add(p + ": unknown controller '" + id + "'"));
            interaction.involvedControlActionIds().stream()
                    .filter(id -> !actionIds.contains(id))
                    .forEach(id -> warnings.add(p + ": unknown control action '" + id + "'"));
        }
    }

    private static void validateAbstractUCCAs(List<AbstractUCCA> uccas,
                                              Set<String> controllerIds, Set<String> actionIds,
                                              List<String> errors, List<String> warnings) {
        Set<String> seen = new HashSet<>();
        for (AbstractUCCA ucca : uccas) {
            if (ucca.id() == null || ucca.id().isBlank()) {
                errors.add("abstract UCCA: 'id' is required");
                continue;
            }
            String p = "abstract UCCA '" + ucca.id() + "'";
            if (!seen.add(ucca.id())) {
                warnings.add(p + ": duplicate 'id'; refined ids will collide");
            }
            if (ucca.code() == null || ucca.code().isBlank()) {
                errors.add(p + ": 'code' is required");
            }
            if (ucca.abstractionLevel() == null) {
                errors.add(p + ": 'abstraction_level' is required (2a or 2b)");
            }
            if (ucca.uccaType() == null) {
                warnings.add(p + ": no 'ucca_type'; only interactions applying to Both will match");
            }
            if (ucca.abstractPattern().isBlank()) {
                warnings.add(p + ": empty pattern; no refinements will be produced");
            } else {
                try {
                    PatternParser.parse(ucca.abstractPattern());
                } catch (PatternSyntaxException e) {
                    warnings.add(p + ": pattern is not supported: " + e.getMessage());
                }
            }
            if (ucca.abstractionLevel() == AbstractionLevel.CONTROLLER_SPECIFIC && ucca.involvedControllerIds().isEmpty()) {
                warnings.add(p + ": controller-specific (2b) without 'controller_ids'; no refinements will be produced");
            }
            ucca.involvedControllerIds().stream()
                    .filter(id -> !controllerIds.contains(id))
                    .forEach(id -> warnings.add(p + ": unknown controller '" + id + "'"));
            ucca.relevantActions().stream()
                    .filter(id -> !actionIds.contains(id))
                    .forEach(id -> warnings.add(p + ": unknown relevant action '" + id + "'"));
        }
    }
}
