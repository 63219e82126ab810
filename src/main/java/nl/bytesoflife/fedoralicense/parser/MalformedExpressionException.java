package nl.bytesoflife.fedoralicense.parser;

import nl.bytesoflife.fedoralicense.model.LicenseFormat;

/**
 * Thrown when a license string does not conform to the grammar of its format.
 */
public class MalformedExpressionException extends RuntimeException {

    private final LicenseFormat format;
    private final String input;
    private final int position;

    public MalformedExpressionException(LicenseFormat format, String input, int position, String detail) {
        super("Malformed " + format + " license string '" + input + "': " + detail + " at position " + position);
        this.format = format;
        this.input = input;
        this.position = position;
    }

    public LicenseFormat getFormat() {
        return format;
    }

    public String getInput() {
        return input;
    }

    public int getPosition() {
        return position;
    }
}
