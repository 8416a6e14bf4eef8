package com.repclub.importer.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhoneUtilsTest {

    @Test
    void stripFormatting_RemovesSeparators() {
        assertEquals("15551234567", PhoneUtils.stripFormatting("+1 (555) 123-4567"));
        assertEquals("555CALL", PhoneUtils.stripFormatting("555.CALL"));
    }

    @Test
    void isValid_ChecksDigitCount() {
        assertTrue(PhoneUtils.isValid("555-1234"));
        assertTrue(PhoneUtils.isValid("+51 999 999 999"));
        assertFalse(PhoneUtils.isValid("123456"));
        assertFalse(PhoneUtils.isValid("1234567890123456"));
        assertFalse(PhoneUtils.isValid("555-CALL-NOW"));
        assertFalse(PhoneUtils.isValid(null));
    }
}
