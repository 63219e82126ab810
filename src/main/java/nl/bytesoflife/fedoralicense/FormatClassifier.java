package nl.bytesoflife.fedoralicense;

import nl.bytesoflife.fedoralicense.model.LicenseFormat;
import nl.bytesoflife.fedoralicense.oracle.LicenseOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides which format a license string is written in.
 * <ol>
 *   <li>Contains {@code AND} or {@code OR}: SPDX.</li>
 *   <li>Contains {@code and} or {@code or}: legacy.</li>
 *   <li>Otherwise the whole string is a single identifier: SPDX if the oracle
 *       recognizes it, legacy if not.</li>
 * </ol>
 * Keyword checks are plain case-sensitive substring tests.
 */
public class FormatClassifier {

    private static final Logger log = LoggerFactory.getLogger(FormatClassifier.class);

    private final LicenseOracle oracle;

    public FormatClassifier(LicenseOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    public LicenseFormat classify(String licenseString) {
        if (licenseString.contains("AND") || licenseString.contains("OR")) {
            return LicenseFormat.SPDX;
        }
        if (licenseString.contains("and") || licenseString.contains("or")) {
            return LicenseFormat.LEGACY;
        }
        boolean recognized = oracle.isRecognized(licenseString);
        log.debug("No keyword in '{}', oracle recognized: {}", licenseString, recognized);
        return recognized ? LicenseFormat.SPDX : LicenseFormat.LEGACY;
    }
}
