package nl.bytesoflife.fedoralicense;

import nl.bytesoflife.fedoralicense.expression.LicenseExpression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;

/**
 * Reduces an expression tree to its sorted, de-duplicated license identifiers.
 */
public class LicenseExtractor {

    public List<String> extract(LicenseExpression expression) {
        TreeSet<String> licenses = new TreeSet<>();
        Deque<LicenseExpression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            LicenseExpression node = stack.pop();
            if (node instanceof LicenseExpression.Identifier id) {
                licenses.add(id.token());
            } else if (node instanceof LicenseExpression.And conjunction) {
                stack.push(conjunction.right());
                stack.push(conjunction.left());
            } else if (node instanceof LicenseExpression.Or disjunction) {
                stack.push(disjunction.right());
                stack.push(disjunction.left());
            }
        }
        return List.copyOf(licenses);
    }
}
