package no.cantara.ucca.constraint;

import java.time.LocalTime;
import java.util.Set;

/**
 * The operating state that authority constraints are evaluated against.
 *
 * <p>A {@code null} component means "unknown": every constraint on that dimension holds.
 *
 * @param mode                   current operating mode, e.g. "approach"
 * @param time                   current time of day
 * @param satisfiedPreconditions ids of preconditions known to hold; {@code null} if not tracked
 */
public record ConstraintContext(
        String mode,
        LocalTime time,
        Set<String> satisfiedPreconditions
) {
    public static final ConstraintContext UNCONSTRAINED = new ConstraintContext(null, null, null);

    public ConstraintContext {
        satisfiedPreconditions = satisfiedPreconditions != null ? Set.copyOf(satisfiedPreconditions) : null;
    }

    public boolean isUnconstrained() {
        return mode == null && time == null && satisfiedPreconditions == null;
    }
}
