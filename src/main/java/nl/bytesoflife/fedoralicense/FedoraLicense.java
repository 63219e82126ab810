package nl.bytesoflife.fedoralicense;

import nl.bytesoflife.fedoralicense.expression.LicenseExpression;
import nl.bytesoflife.fedoralicense.model.LicenseFormat;
import nl.bytesoflife.fedoralicense.oracle.LicenseOracle;
import nl.bytesoflife.fedoralicense.oracle.SpdxLicenseList;
import nl.bytesoflife.fedoralicense.parser.LicenseExpressionParser;
import nl.bytesoflife.fedoralicense.parser.LicenseGrammar;
import nl.bytesoflife.fedoralicense.parser.MalformedExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses the License field of a Fedora RPM spec file and keeps the result of the
 * most recent parse.
 * <p>
 * A license string comes in one of two formats: the old one with lowercase
 * {@code and}/{@code or} and free-text license names, or the new one with uppercase
 * {@code AND}/{@code OR} and SPDX identifiers. A string valid in both, such as
 * {@code MIT}, is treated as SPDX when the identifier is a known SPDX id.
 * <p>
 * Instances are not thread-safe.
 */
public class FedoraLicense {

    private static final Logger log = LoggerFactory.getLogger(FedoraLicense.class);

    private final FormatClassifier classifier;
    private final LicenseExpressionParser parser = new LicenseExpressionParser();
    private final LicenseExtractor extractor = new LicenseExtractor();

    private ParseResult result;

    public FedoraLicense() {
        this(SpdxLicenseList.listed());
    }

    public FedoraLicense(LicenseOracle oracle) {
        this.classifier = new FormatClassifier(oracle);
    }

    /**
     * Parses {@code licenseString}, replacing any previous result. If parsing fails
     * no result is held afterwards.
     *
     * @throws MalformedExpressionException if the string does not match the grammar of its format
     */
    public void parse(String licenseString) {
        reset();
        Objects.requireNonNull(licenseString, "licenseString");

        LicenseFormat format = classifier.classify(licenseString);
        LicenseExpression expression = parser.parse(licenseString, LicenseGrammar.forFormat(format));
        List<String> licenses = extractor.extract(expression);

        result = new ParseResult(licenseString, format, expression, licenses);
        log.debug("Parsed '{}' as {} format: {}", licenseString, format, licenses);
    }

    /**
     * Format of the last parsed license string.
     *
     * @throws NotReadyException if nothing has been parsed since construction or the last reset
     */
    public LicenseFormat format() {
        return result().format();
    }

    /**
     * Licenses used in the last parsed license string, sorted alphabetically
     * without duplicates.
     *
     * @throws NotReadyException if nothing has been parsed since construction or the last reset
     */
    public List<String> licenses() {
        return result().licenses();
    }

    public String input() {
        return result().input();
    }

    public LicenseExpression expression() {
        return result().expression();
    }

    public ParseResult result() {
        if (result == null) {
            throw new NotReadyException();
        }
        return result;
    }

    public boolean isReady() {
        return result != null;
    }

    public void reset() {
        result = null;
    }
}
