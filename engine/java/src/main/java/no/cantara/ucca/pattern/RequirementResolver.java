package no.cantara.ucca.pattern;

import no.cantara.ucca.model.AbstractUCCA;
import no.cantara.ucca.model.ActionRequirement;
import no.cantara.ucca.model.ControlAction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a parsed pattern into {@link ActionRequirement}s, resolving names to control actions.
 *
 * <p>Requirements are emitted negated first, then bare names, then the "any of" members that
 * are also listed in the abstract UCCA's relevant actions. Names that match no control action
 * are dropped.
 */
public class RequirementResolver {

    private static final Logger logger = Logger.getLogger(RequirementResolver.class.getName());

    private final Map<String, ControlAction> byName = new HashMap<>();
    private final Map<String, ControlAction> byId = new HashMap<>();

    public RequirementResolver(List<ControlAction> controlActions) {
        for (ControlAction action : controlActions) {
            if (action.name() != null) byName.putIfAbsent(action.name(), action);
            byId.putIfAbsent(action.id(), action);
        }
    }

    public Optional<ControlAction> resolve(String nameOrId) {
        ControlAction action = byName.get(nameOrId);
        if (action == null) action = byId.get(nameOrId);
        return Optional.ofNullable(action);
    }

    /**
     * Parses and resolves the pattern of {@code abstractUCCA}.
     *
     * @throws PatternSyntaxException if the pattern is outside the supported grammar
     */
    public List<ActionRequirement> requirements(AbstractUCCA abstractUCCA) {
        return requirements(PatternParser.parse(abstractUCCA.abstractPattern()), abstractUCCA.relevantActions());
    }

    public List<ActionRequirement> requirements(PatternExpression pattern, Set<String> relevantActions) {
        List<PatternExpression.ActionRef> refs = new ArrayList<>();
        List<PatternExpression.AnyOf> sets = new ArrayList<>();
        collect(pattern, refs, sets);

        Set<ActionRequirement> requirements = new LinkedHashSet<>();
        for (PatternExpression.ActionRef ref : refs) {
            if (ref.negated()) {
                resolveLogged(ref.name()).ifPresent(a -> requirements.add(ActionRequirement.negated(a.id())));
            }
        }
        Set<String> bareRequired = new LinkedHashSet<>();
        for (PatternExpression.ActionRef ref : refs) {
            if (!ref.negated()) {
                resolveLogged(ref.name()).ifPresent(a -> {
                    requirements.add(ActionRequirement.required(a.id()));
                    bareRequired.add(a.id());
                });
            }
        }
        for (PatternExpression.AnyOf set : sets) {
            for (String name : set.names()) {
                Optional<ControlAction> action = resolveLogged(name);
                if (action.isEmpty()) continue;
                String id = action.get().id();
                if (!relevantActions.contains(id)) {
                    logger.fine(() -> "'any of' member '" + name + "' is not a relevant action; skipped");
                } else if (!bareRequired.contains(id)) {
                    requirements.add(ActionRequirement.fromSet(id));
                }
            }
        }
        return List.copyOf(requirements);
    }

    private Optional<ControlAction> resolveLogged(String name) {
        Optional<ControlAction> action = resolve(name);
        if (action.isEmpty()) {
            logger.fine(() -> "Pattern token '" + name + "' does not name a control action; dropped");
        }
        return action;
    }

    private static void collect(PatternExpression expression,
                                List<PatternExpression.ActionRef> refs,
                                List<PatternExpression.AnyOf> sets) {
        if (expression instanceof PatternExpression.ActionRef ref) {
            refs.add(ref);
        } else if (expression instanceof PatternExpression.AnyOf set) {
            sets.add(set);
        } else if (expression instanceof PatternExpression.Conjunction conjunction) {
            conjunction.terms().forEach(t -> collect(t, refs, sets));
        }
    }
}
