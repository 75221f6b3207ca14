package no.cantara.ucca.refine;

import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.AbstractionLevel;
import no.cantara.ucca.model.ActionRequirement;
import no.cantara.ucca.model.ControlAction;
import no.cantara.ucca.model.Controller;
import no.cantara.ucca.model.ControllerAssignment;
import no.cantara.ucca.model.Priority;
import no.cantara.ucca.model.RefinedUCCA;
import no.cantara.ucca.model.RefinementStatus;
import no.cantara.ucca.model.RefinementWorkspace;
import no.cantara.ucca.model.UCCAHierarchy;
import no.cantara.ucca.model.UCCARefinementConfig;
import no.cantara.ucca.pattern.PatternSyntaxException;
import no.cantara.ucca.pattern.RequirementResolver;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Refines abstract UCCAs into controller-bound ones.
 *
 * <p>Each abstract UCCA is parsed into action requirements, expanded into candidate assignment
 * sets, filtered against authority and special interactions, deduplicated by interchangeability
 * and scored. The indices are built once in the constructor and only read afterwards.
 */
public class UCCARefinementEngine {

    private static final Logger logger = Logger.getLogger(UCCARefinementEngine.class.getName());

    private final UCCARefinementConfig config;
    private final RequirementResolver resolver;
    private final CombinationGenerator generator;
    private final ConstraintFilter filter;
    private final EquivalenceDeduplicator deduplicator;
    private final PriorityScorer scorer;
    private final RefinementDescriber describer;

    /**
     * @throws InvalidRefinementConfigException if groups overlap and the config's policy is REJECT
     */
    public UCCARefinementEngine(UCCARefinementConfig config,
                                List<Controller> controllers,
                                List<ControlAction> controlActions) {
        this.config = config;
        AuthorityIndex authority = AuthorityIndex.build(config.authorityRelationships());
        InterchangeabilityIndex groups = InterchangeabilityIndex.build(
                config.interchangeableGroups(), config.groupOverlapPolicy());
        this.resolver = new RequirementResolver(controlActions);
        this.generator = new CombinationGenerator(authority, controllers, config);
        this.filter = new ConstraintFilter(authority, config);
        this.deduplicator = new EquivalenceDeduplicator(groups, config.operatingContext());
        this.scorer = new PriorityScorer(config.specialInteractions());
        this.describer = new RefinementDescriber(controllers, controlActions);
    }

    public static UCCARefinementEngine forWorkspace(RefinementWorkspace workspace) {
        return new UCCARefinementEngine(workspace.config(), workspace.controllers(), workspace.controlActions());
    }

    public UCCARefinementConfig config() {
        return config;
    }

    public List<UCCAHierarchy> refineAbstractUCCAs(List<AbstractUCCA> abstractUCCAs) {
        return refineAbstractUCCAs(abstractUCCAs, () -> false);
    }

    /**
     * Refines each abstract UCCA in order. {@code cancelled} is checked before each one; once it
     * returns true the hierarchies assembled so far are returned.
     */
    public List<UCCAHierarchy> refineAbstractUCCAs(List<AbstractUCCA> abstractUCCAs, BooleanSupplier cancelled) {
        List<UCCAHierarchy> hierarchies = new ArrayList<>(abstractUCCAs.size());
        for (AbstractUCCA abstractUCCA : abstractUCCAs) {
            if (cancelled.getAsBoolean()) {
                logger.info("Refinement cancelled after " + hierarchies.size() + " of "
                        + abstractUCCAs.size() + " abstract UCCAs");
                break;
            }
            hierarchies.add(refine(abstractUCCA));
        }
        return hierarchies;
    }

    public UCCAHierarchy refine(AbstractUCCA abstractUCCA) {
        List<ActionRequirement> requirements;
        try {
            requirements = resolver.requirements(abstractUCCA);
        } catch (PatternSyntaxException e) {
            logger.warning("Abstract UCCA '" + abstractUCCA.id() + "': " + e.getMessage());
            return UCCAHierarchy.failed(abstractUCCA, RefinementStatus.INVALID_PATTERN, e.getMessage());
        }

        CombinationGenerator.CandidateSpace candidates;
        try {
            candidates = generator.candidates(abstractUCCA, requirements, config.maxCombinationsPerUCCA());
        } catch (CombinationLimitExceededException e) {
            logger.warning(e.getMessage());
            return UCCAHierarchy.failed(abstractUCCA, RefinementStatus.COMBINATION_LIMIT_EXCEEDED, e.getMessage());
        }

        List<RefinedUCCA> accepted = new ArrayList<>();
        for (List<ControllerAssignment> candidate : candidates) {
            if (filter.accepts(candidate, abstractUCCA.uccaType())) {
                accepted.add(assemble(abstractUCCA, candidate, accepted.size() + 1));
            } else if (logger.isLoggable(Level.FINE)) {
                logger.fine("Candidate " + candidate + " rejected: "
                        + filter.rejectionReason(candidate, abstractUCCA.uccaType()).orElse("?"));
            }
        }

        List<RefinedUCCA> refined = deduplicator.deduplicate(accepted).stream()
                .map(scorer::prioritize)
                .toList();

        int pruned = (int) refined.stream().filter(RefinedUCCA::isPruned).count();
        int high = (int) refined.stream().filter(r -> !r.isPruned() && r.priority() == Priority.HIGH).count();
        RefinementStatus status = refined.isEmpty() ? RefinementStatus.NO_REFINEMENT : RefinementStatus.REFINED;
        logger.fine(() -> "Abstract UCCA '" + abstractUCCA.id() + "': " + requirements.size() + " requirement(s), "
                + candidates.size() + " candidate(s), " + refined.size() + " refined, " + pruned + " pruned");
        return new UCCAHierarchy(abstractUCCA, refined, refined.size(), pruned, high, status, null);
    }

    private RefinedUCCA assemble(AbstractUCCA abstractUCCA, List<ControllerAssignment> assignments, int ordinal) {
        List<String> involved = abstractUCCA.abstractionLevel() == AbstractionLevel.TEAM_LEVEL
                ? List.copyOf(distinctControllers(assignments))
                : abstractUCCA.involvedControllerIds();
        return new RefinedUCCA(
                abstractUCCA.id() + "-R" + ordinal,
                describer.code(abstractUCCA.code(), assignments),
                describer.description(assignments, abstractUCCA.context()),
                abstractUCCA.context(),
                abstractUCCA.hazardIds(),
                abstractUCCA.uccaType(),
                involved,
                abstractUCCA.id(),
                assignments,
                Priority.MEDIUM,
                null,
                false,
                null,
                abstractUCCA.temporalRelationship()
        );
    }

    private static LinkedHashSet<String> distinctControllers(List<ControllerAssignment> assignments) {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        assignments.forEach(a -> ids.add(a.controllerId()));
        return ids;
    }
}
