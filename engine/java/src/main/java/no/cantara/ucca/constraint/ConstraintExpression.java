package no.cantara.ucca.constraint;

import java.time.LocalTime;

/**
 * A parsed authority or group constraint.
 *
 * <p>Variants: {@link TimeWindow}, {@link ModeEquals}, {@link PreconditionRef} and {@link Unparsed}
 * for legacy free text, which always holds.
 */
public interface ConstraintExpression {

    boolean holds(ConstraintContext context);

    /** The constraint text as declared. */
    String source();

    /** Holds when the context time lies in [from, to); windows with from &gt; to wrap past midnight. */
    record TimeWindow(LocalTime from, LocalTime to, String source) implements ConstraintExpression {
        @Override
        public boolean holds(ConstraintContext context) {
            LocalTime now = context.time();
            if (now == null) return true;
            if (!from.isAfter(to)) {
                return !now.isBefore(from) && now.isBefore(to);
            }
            return !now.isBefore(from) || now.isBefore(to);
        }
    }

    record ModeEquals(String mode, String source) implements ConstraintExpression {
        @Override
        public boolean holds(ConstraintContext context) {
            return context.mode() == null || context.mode().equalsIgnoreCase(mode);
        }
    }

    record PreconditionRef(String preconditionId, String source) implements ConstraintExpression {
        @Override
        public boolean holds(ConstraintContext context) {
            return context.satisfiedPreconditions() == null
                    || context.satisfiedPreconditions().contains(preconditionId);
        }
    }

    record Unparsed(String source) implements ConstraintExpression {
        @Override
        public boolean holds(ConstraintContext context) {
            return true;
        }
    }
}
