package no.cantara.ucca.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for abstract UCCA patterns.
 *
 * <pre>
 * pattern := term ( [conj] term )*
 * conj    := '∧' | '&amp;&amp;' | '&amp;' | 'and' | ','
 * term    := neg name | 'any' 'of' '{' name (',' name)* '}' | '(' pattern ')' | name
 * neg     := '¬' | '!' | '~' | 'not'
 * </pre>
 *
 * At most one "any of" clause is allowed per pattern.
 */
public final class PatternParser {

    private final List<Token> tokens;
    private int index;
    private boolean anyOfSeen;

    private PatternParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static PatternExpression parse(String pattern) {
        PatternParser parser = new PatternParser(new PatternTokenizer(pattern).tokenize());
        PatternExpression expression = parser.parsePattern();
        Token trailing = parser.peek();
        if (trailing.type() != Token.Type.EOF) {
            throw new PatternSyntaxException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return expression;
    }

    private PatternExpression parsePattern() {
        List<PatternExpression> terms = new ArrayList<>();
        while (startsTerm(peek())) {
            terms.add(parseTerm());
            Token next = peek();
            if (next.type() == Token.Type.AND || next.type() == Token.Type.COMMA) {
                advance();
                if (!startsTerm(peek())) {
                    throw new PatternSyntaxException("Expected a term after '" + next.text() + "'", peek().position());
                }
            }
        }
        return new PatternExpression.Conjunction(terms);
    }

    private PatternExpression parseTerm() {
        Token t = advance();
        switch (t.type()) {
            case NOT -> {
                Token operand = peek();
                if (operand.type() == Token.Type.LPAREN || isAnyOf()) {
                    throw new PatternSyntaxException("Negation applies to a single action only", operand.position());
                }
                return new PatternExpression.ActionRef(expectName().text(), true);
            }
            case LPAREN -> {
                PatternExpression inner = parsePattern();
                expect(Token.Type.RPAREN, "')'");
                return inner;
            }
            case NAME -> {
                if (t.isName("any") && peek().isName("of") && peekAhead(1).type() == Token.Type.LBRACE) {
                    return parseAnyOf(t);
                }
                return new PatternExpression.ActionRef(t.text(), false);
            }
            default -> throw new PatternSyntaxException("Unexpected '" + t.text() + "'", t.position());
        }
    }

    private PatternExpression parseAnyOf(Token anyToken) {
        if (anyOfSeen) {
            throw new PatternSyntaxException("Only one 'any of' clause is supported", anyToken.position());
        }
        anyOfSeen = true;
        advance(); // of
        advance(); // {
        List<String> names = new ArrayList<>();
        names.add(expectName().text());
        while (peek().type() == Token.Type.COMMA) {
            advance();
            names.add(expectName().text());
        }
        expect(Token.Type.RBRACE, "'}'");
        return new PatternExpression.AnyOf(names);
    }

    private boolean isAnyOf() {
        return peek().isName("any") && peekAhead(1).isName("of");
    }

    private static boolean startsTerm(Token t) {
        return t.type() == Token.Type.NAME || t.type() == Token.Type.NOT || t.type() == Token.Type.LPAREN;
    }

    private Token expectName() {
        return expect(Token.Type.NAME, "an action name");
    }

    private Token expect(Token.Type type, String what) {
        Token t = peek();
        if (t.type() != type) {
            String found = t.type() == Token.Type.EOF ? "end of pattern" : "'" + t.text() + "'";
            throw new PatternSyntaxException("Expected " + what + " but found " + found, t.position());
        }
        return advance();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (t.type() != Token.Type.EOF) index++;
        return t;
    }
}
