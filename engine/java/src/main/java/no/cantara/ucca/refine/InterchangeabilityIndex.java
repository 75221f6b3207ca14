package no.cantara.ucca.refine;

import no.cantara.ucca.constraint.ConstraintContext;
import no.cantara.ucca.constraint.ConstraintParser;
import no.cantara.ucca.model.GroupOverlapPolicy;
import no.cantara.ucca.model.InterchangeabilityType;
import no.cantara.ucca.model.InterchangeableControllerGroup;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lookup from controller to the interchangeable group it belongs to.
 */
public final class InterchangeabilityIndex {

    private static final Logger logger = Logger.getLogger(InterchangeabilityIndex.class.getName());

    private final Map<String, InterchangeableControllerGroup> groupByController;

    private InterchangeabilityIndex(Map<String, InterchangeableControllerGroup> groupByController) {
        this.groupByController = groupByController;
    }

    /**
     * @throws InvalidRefinementConfigException if a controller is in two groups and {@code policy} is REJECT
     */
    public static InterchangeabilityIndex build(List<InterchangeableControllerGroup> groups, GroupOverlapPolicy policy) {
        Map<String, InterchangeableControllerGroup> map = new HashMap<>();
        for (InterchangeableControllerGroup group : groups) {
            for (String controllerId : group.controllerIds()) {
                InterchangeableControllerGroup previous = map.put(controllerId, group);
                if (previous != null && !previous.id().equals(group.id())) {
                    String msg = "Controller '" + controllerId + "' is in groups '" + previous.id()
                            + "' and '" + group.id() + "'";
                    if (policy == GroupOverlapPolicy.REJECT) {
                        throw new InvalidRefinementConfigException(msg);
                    }
                    logger.warning(msg + "; using '" + group.id() + "'");
                }
            }
        }
        return new InterchangeabilityIndex(map);
    }

    public Optional<InterchangeableControllerGroup> groupOf(String controllerId) {
        return Optional.ofNullable(groupByController.get(controllerId));
    }

    /**
     * The id a controller is known by for equivalence: its group id if grouped, else its own id.
     * Conditional groups only count while their conditions hold in {@code context}.
     */
    public String canonicalId(String controllerId, ConstraintContext context) {
        InterchangeableControllerGroup group = groupByController.get(controllerId);
        if (group == null) return controllerId;
        if (group.interchangeabilityType() == InterchangeabilityType.CONDITIONAL
                && !ConstraintParser.allHold(group.conditions(), context)) {
            return controllerId;
        }
        return group.id();
    }
}
