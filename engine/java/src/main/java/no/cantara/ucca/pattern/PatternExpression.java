package no.cantara.ucca.pattern;

import java.util.List;

/**
 * Parsed form of an abstract pattern.
 */
public interface PatternExpression {

    /** A single action name, optionally negated: {@code Deploy} or {@code ¬Deploy}. */
    record ActionRef(String name, boolean negated) implements PatternExpression {}

    /** An "any of {a, b, c}" selection. */
    record AnyOf(List<String> names) implements PatternExpression {
        public AnyOf {
            names = List.copyOf(names);
        }
    }

    /** Terms that must hold together. Juxtaposed terms are conjoined as well. */
    record Conjunction(List<PatternExpression> terms) implements PatternExpression {
        public Conjunction {
            terms = List.copyOf(terms);
        }
    }
}
