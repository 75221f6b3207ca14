package no.cantara.ucca.pattern;

/**
 * A lexical token of an abstract pattern.
 *
 * @param position character offset in the pattern, for error messages
 */
record Token(Type type, String text, int position) {

    enum Type {
        NAME,
        NOT,
        AND,
        COMMA,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        EOF
    }

    boolean isName(String word) {
        return type == Type.NAME && text.equalsIgnoreCase(word);
    }
}
