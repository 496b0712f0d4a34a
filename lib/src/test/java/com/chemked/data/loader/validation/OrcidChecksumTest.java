package com.chemked.data.loader.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class OrcidChecksumTest {

    @Test
    void validatesCheckDigit() {
        assertTrue(OrcidChecksum.isValid("0000-0003-4425-7097"));
        assertTrue(OrcidChecksum.isValid("0000-0002-1825-0097"));
        assertTrue(OrcidChecksum.isValid("0000-0001-5109-3700"));
        assertTrue(OrcidChecksum.isValid("0000-0002-1694-233X"));
        assertFalse(OrcidChecksum.isValid("0000-0002-1825-0098"));
        assertFalse(OrcidChecksum.isValid("0000-0002-1694-2330"));
        assertEquals('X', OrcidChecksum.checkDigit("000000021694233"));
    }

    @Test
    void requiresGroupedSixteenCharacterForm() {
        assertTrue(OrcidChecksum.isWellFormed("0000-0002-1825-0098"));
        assertFalse(OrcidChecksum.isWellFormed("0000000218250097"));
        assertFalse(OrcidChecksum.isWellFormed("0000-0002-1825-009"));
        assertFalse(OrcidChecksum.isWellFormed("0000-0002-1694-233x"));
        assertFalse(OrcidChecksum.isWellFormed("https://orcid.org/0000-0002-1825-0097"));
        assertFalse(OrcidChecksum.isWellFormed(null));
        assertFalse(OrcidChecksum.isValid(null));
    }
}
