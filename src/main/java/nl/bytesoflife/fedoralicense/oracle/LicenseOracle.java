package nl.bytesoflife.fedoralicense.oracle;

/**
 * Answers whether a token is a recognized license identifier. Only consulted to
 * classify license strings that carry no boolean keyword.
 */
@FunctionalInterface
public interface LicenseOracle {

    boolean isRecognized(String token);
}
