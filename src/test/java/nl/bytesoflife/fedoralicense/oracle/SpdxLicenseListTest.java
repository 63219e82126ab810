package nl.bytesoflife.fedoralicense.oracle;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpdxLicenseListTest {

    @Test
    void listedLicensesLoadAndAreCached() {
        SpdxLicenseList list = SpdxLicenseList.listed();
        assertTrue(list.size() > 400);
        assertSame(list, SpdxLicenseList.listed());
    }

    @Test
    void listedLicensesKnowCommonIdentifiers() {
        SpdxLicenseList list = SpdxLicenseList.listed();
        assertTrue(list.isRecognized("MIT"));
        assertTrue(list.isRecognized("Apache-2.0"));
        assertTrue(list.isRecognized("GPL-2.0-or-later"));
        assertTrue(list.isRecognized("FSFAP"));
    }

    @Test
    void listedLicensesKnowLessCommonIdentifiers() {
        SpdxLicenseList list = SpdxLicenseList.listed();
        assertTrue(list.isRecognized("Bitstream-Vera"));
        assertTrue(list.isRecognized("Linux-man-pages-copyleft"));
        assertTrue(list.isRecognized("OFL-1.1-RFN"));
    }

    @Test
    void legacyNamesAreNotRecognized() {
        SpdxLicenseList list = SpdxLicenseList.listed();
        assertFalse(list.isRecognized("ASL 2.0"));
        assertFalse(list.isRecognized("GPLv2+"));
        assertFalse(list.isRecognized("mit"));
        assertFalse(list.isRecognized(null));
    }

    @Test
    void ofCollection() {
        SpdxLicenseList list = SpdxLicenseList.of(List.of("Foo-1.0", "Foo-1.0"));
        assertEquals(1, list.size());
        assertTrue(list.isRecognized("Foo-1.0"));
        assertFalse(list.isRecognized("MIT"));
    }
}
