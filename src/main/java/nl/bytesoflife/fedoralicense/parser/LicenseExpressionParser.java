package nl.bytesoflife.fedoralicense.parser;

import nl.bytesoflife.fedoralicense.expression.LicenseExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Recursive descent parser for Fedora license strings. Operator chains are read
 * in a loop and folded to the right; only parenthesized groups recurse, up to
 * {@link #MAX_NESTING} levels. Not thread-safe; a single instance may be reused
 * for any number of sequential parses.
 */
public class LicenseExpressionParser {

    static final int MAX_NESTING = 256;

    private LicenseGrammar grammar;
    private String input;
    private int pos;
    private int depth;

    public LicenseExpression parse(String text, LicenseGrammar grammar) {
        this.input = Objects.requireNonNull(text, "text");
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.pos = 0;
        this.depth = 0;

        skipWhitespace();
        if (pos >= input.length()) {
            throw malformed("Empty license string");
        }
        LicenseExpression expression = parseExpression();
        skipWhitespace();
        if (pos < input.length()) {
            throw malformed("Unexpected '" + input.charAt(pos) + "'");
        }
        return expression;
    }

    private LicenseExpression parseExpression() {
        List<LicenseExpression> operands = new ArrayList<>();
        operands.add(parseAndExpression());
        while (acceptKeyword(grammar.orKeyword())) {
            operands.add(parseAndExpression());
        }
        return foldRight(operands, LicenseExpression.Or::new);
    }

    private LicenseExpression parseAndExpression() {
        List<LicenseExpression> operands = new ArrayList<>();
        operands.add(parseAtom());
        while (acceptKeyword(grammar.andKeyword())) {
            operands.add(parseAtom());
        }
        return foldRight(operands, LicenseExpression.And::new);
    }

    private LicenseExpression parseAtom() {
        skipWhitespace();
        if (pos >= input.length()) {
            throw malformed("Unexpected end of input, expected license identifier or '('");
        }
        if (input.charAt(pos) == '(') {
            if (depth == MAX_NESTING) {
                throw malformed("Parentheses nested deeper than " + MAX_NESTING + " levels");
            }
            pos++;
            depth++;
            LicenseExpression inner = parseExpression();
            skipWhitespace();
            expect(')');
            depth--;
            return inner;
        }
        int end = grammar.identifierEnd(input, pos);
        if (end == pos) {
            throw malformed("Expected license identifier");
        }
        String token = input.substring(pos, end);
        pos = end;
        return new LicenseExpression.Identifier(token);
    }

    private boolean acceptKeyword(String keyword) {
        skipWhitespace();
        int end = grammar.matchKeyword(input, pos, keyword);
        if (end < 0) {
            return false;
        }
        pos = end;
        return true;
    }

    // a, b, c -> op(a, op(b, c))
    private static LicenseExpression foldRight(List<LicenseExpression> operands,
                                               BinaryOperator<LicenseExpression> operator) {
        LicenseExpression result = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; i--) {
            result = operator.apply(operands.get(i), result);
        }
        return result;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw malformed("Expected '" + expected + "'");
        }
        pos++;
    }

    private MalformedExpressionException malformed(String detail) {
        return new MalformedExpressionException(grammar.format(), input, pos, detail);
    }
}
