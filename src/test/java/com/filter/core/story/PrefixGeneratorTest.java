package com.filter.core.story;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrefixGeneratorTest {

    @Test
    @DisplayName("long names are truncated to five characters after dropping trailing digits")
    void truncates() {
        assertEquals("ibstr", PrefixGenerator.generate("ibstreams-2"));
        assertEquals("paymn", PrefixGenerator.generate("Paymnt_Service"));
    }

    @Test
    @DisplayName("short names are padded with x")
    void pads() {
        assertEquals("apixx", PrefixGenerator.generate("api"));
        assertEquals("xxxxx", PrefixGenerator.generate(null));
    }

    @Test
    @DisplayName("isValid accepts 1-16 alphanumerics only")
    void validity() {
        assertTrue(PrefixGenerator.isValid("api"));
        assertTrue(PrefixGenerator.isValid("A1"));
        assertFalse(PrefixGenerator.isValid(""));
        assertFalse(PrefixGenerator.isValid("has-dash"));
        assertFalse(PrefixGenerator.isValid("a".repeat(17)));
    }
}
