package nl.bytesoflife.fedoralicense.model;

/**
 * The two conventions used for the License field of Fedora RPM spec files.
 */
public enum LicenseFormat {
    LEGACY(1, "Old RPM Fedora format"),
    SPDX(2, "New RPM Fedora format with SPDX license ids");

    private final int number;
    private final String description;

    LicenseFormat(int number, String description) {
        this.number = number;
        this.description = description;
    }

    public int getNumber() {
        return number;
    }

    public String getDescription() {
        return description;
    }

    public static LicenseFormat fromNumber(int number) {
        return switch (number) {
            case 1 -> LEGACY;
            case 2 -> SPDX;
            default -> throw new IllegalArgumentException("Unknown license string format: " + number);
        };
    }
}
