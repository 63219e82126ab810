package nl.bytesoflife.fedoralicense;

import nl.bytesoflife.fedoralicense.expression.LicenseExpression;
import nl.bytesoflife.fedoralicense.model.LicenseFormat;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one successful parse of a license string.
 */
public record ParseResult(String input, LicenseFormat format, LicenseExpression expression, List<String> licenses) {

    public ParseResult {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(expression, "expression");
        licenses = List.copyOf(licenses);
    }
}
