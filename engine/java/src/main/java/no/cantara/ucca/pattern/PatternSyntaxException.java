package no.cantara.ucca.pattern;

/**
 * Thrown when an abstract pattern falls outside the supported grammar.
 */
public class PatternSyntaxException extends IllegalArgumentException {

    private final int position;

    public PatternSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
