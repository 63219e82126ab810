package nl.bytesoflife.fedoralicense.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spdx.library.InvalidSPDXAnalysisException;
import org.spdx.library.model.license.ListedLicenses;
import org.spdx.storage.listedlicense.SpdxListedLicenseEmbeddedStore;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set of SPDX license identifiers, matched exactly (case-sensitive).
 */
public class SpdxLicenseList implements LicenseOracle {

    private static final Logger log = LoggerFactory.getLogger(SpdxLicenseList.class);

    private static volatile SpdxLicenseList cachedListed;

    private final Set<String> identifiers;

    private SpdxLicenseList(Set<String> identifiers) {
        this.identifiers = Set.copyOf(identifiers);
    }

    /**
     * The SPDX License List embedded in java-spdx-library, read once per class loader
     * without network access.
     */
    public static SpdxLicenseList listed() {
        if (cachedListed == null) {
            synchronized (SpdxLicenseList.class) {
                if (cachedListed == null) {
                    cachedListed = loadListed();
                }
            }
        }
        return cachedListed;
    }

    public static SpdxLicenseList of(Collection<String> identifiers) {
        return new SpdxLicenseList(new LinkedHashSet<>(identifiers));
    }

    @Override
    public boolean isRecognized(String token) {
        return token != null && identifiers.contains(token);
    }

    public boolean contains(String identifier) {
        return isRecognized(identifier);
    }

    public int size() {
        return identifiers.size();
    }

    private static SpdxLicenseList loadListed() {
        try {
            ListedLicenses listedLicenses =
                    ListedLicenses.initializeListedLicenses(new SpdxListedLicenseEmbeddedStore());
            SpdxLicenseList list = of(listedLicenses.getSpdxListedLicenseIds());
            log.debug("Loaded {} SPDX listed license identifiers", list.size());
            return list;
        } catch (InvalidSPDXAnalysisException e) {
            throw new IllegalStateException("Failed to load SPDX license list", e);
        }
    }

    @Override
    public String toString() {
        return "SpdxLicenseList{identifiers=" + identifiers.size() + "}";
    }
}
