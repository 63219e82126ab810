package nl.bytesoflife.fedoralicense.cli;

import nl.bytesoflife.fedoralicense.FedoraLicense;
import nl.bytesoflife.fedoralicense.parser.MalformedExpressionException;

import java.io.PrintStream;

/**
 * Prints the format and the licenses of a Fedora license string.
 * <pre>
 *   $ parse-fedora-license-string 'MIT AND FSFAP'
 *   Fedora license string: MIT AND FSFAP
 *   Format: 2
 *   Contain licenses:
 *   - FSFAP
 *   - MIT
 * </pre>
 */
public class ParseFedoraLicenseString {

    static final int EXIT_USAGE = 1;
    static final int EXIT_MALFORMED = 2;

    private final FedoraLicense fedoraLicense;

    public ParseFedoraLicenseString(FedoraLicense fedoraLicense) {
        this.fedoraLicense = fedoraLicense;
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println("Usage: parse-fedora-license-string fedora_license_string");
            return EXIT_USAGE;
        }
        String licenseString = args[0];

        try {
            fedoraLicense.parse(licenseString);
        } catch (MalformedExpressionException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_MALFORMED;
        }

        out.println("Fedora license string: " + licenseString);
        out.println("Format: " + fedoraLicense.format().getNumber());
        out.println("Contain licenses:");
        for (String license : fedoraLicense.licenses()) {
            out.println("- " + license);
        }
        return 0;
    }

    public static void main(String[] args) {
        int status = new ParseFedoraLicenseString(new FedoraLicense()).run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }
}
