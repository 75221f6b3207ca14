package no.cantara.ucca.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an abstract pattern into {@link Token}s.
 *
 * <p>Names are runs of letters, digits, '_' and inner '-', or double-quoted strings.
 * The bare words {@code and} and {@code not} are operators; quote them to use them as names.
 * Disjunction and implication symbols are rejected; other punctuation separates names.
 */
final class PatternTokenizer {

    private static final String UNSUPPORTED = "∨|⊕→⇒↔⇔∀∃";

    private final String input;
    private int pos;

    PatternTokenizer(String input) {
        this.input = input != null ? input : "";
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            int start = pos;
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '¬' || c == '!' || c == '~') {
                tokens.add(new Token(Token.Type.NOT, String.valueOf(c), start));
                pos++;
            } else if (c == '∧') {
                tokens.add(new Token(Token.Type.AND, "∧", start));
                pos++;
            } else if (c == '&') {
                pos++;
                if (pos < input.length() && input.charAt(pos) == '&') pos++;
                tokens.add(new Token(Token.Type.AND, input.substring(start, pos), start));
            } else if (c == ',') {
                tokens.add(new Token(Token.Type.COMMA, ",", start));
                pos++;
            } else if (c == '{') {
                tokens.add(new Token(Token.Type.LBRACE, "{", start));
                pos++;
            } else if (c == '}') {
                tokens.add(new Token(Token.Type.RBRACE, "}", start));
                pos++;
            } else if (c == '(') {
                tokens.add(new Token(Token.Type.LPAREN, "(", start));
                pos++;
            } else if (c == ')') {
                tokens.add(new Token(Token.Type.RPAREN, ")", start));
                pos++;
            } else if (c == '"') {
                tokens.add(new Token(Token.Type.NAME, readQuoted(), start));
            } else if (isNameChar(c)) {
                String word = readWord();
                tokens.add(new Token(wordType(word), word, start));
            } else if (UNSUPPORTED.indexOf(c) >= 0) {
                throw new PatternSyntaxException("Unsupported operator '" + c + "'", start);
            } else {
                pos++;
            }
        }
        tokens.add(new Token(Token.Type.EOF, "", input.length()));
        return tokens;
    }

    private static Token.Type wordType(String word) {
        if (word.equalsIgnoreCase("and")) return Token.Type.AND;
        if (word.equalsIgnoreCase("not")) return Token.Type.NOT;
        return Token.Type.NAME;
    }

    private String readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            boolean innerHyphen = c == '-' && pos + 1 < input.length() && isNameChar(input.charAt(pos + 1));
            if (!isNameChar(c) && !innerHyphen) break;
            pos++;
        }
        return input.substring(start, pos);
    }

    private String readQuoted() {
        int start = pos;
        int close = input.indexOf('"', pos + 1);
        if (close < 0) {
            throw new PatternSyntaxException("Unterminated quoted name", start);
        }
        pos = close + 1;
        return input.substring(start + 1, close);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
