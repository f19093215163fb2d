package com.afterlands.aftercodec.core.language;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class LanguageCodesTest {

    @Test
    void normalize() {
        assertEquals("pt-br", LanguageCodes.normalize(" pt_BR "));
        assertEquals("zh-hant-tw", LanguageCodes.normalize("zh-Hant-TW"));
    }

    @Test
    void matchingIgnoresSpelling() {
        assertTrue(LanguageCodes.matches("en_US", "en-us"));
        assertFalse(LanguageCodes.matches("en", "en-US"));
        assertFalse(LanguageCodes.matches(null, "en"));
        assertTrue(LanguageCodes.sameBase("pt-BR", "pt_PT"));
        assertEquals("pt", LanguageCodes.baseLanguage("pt_BR"));
    }

    @Test
    void wellFormed() {
        assertTrue(LanguageCodes.isWellFormed("en"));
        assertTrue(LanguageCodes.isWellFormed("sr_Latn_RS"));
        assertFalse(LanguageCodes.isWellFormed("e"));
        assertFalse(LanguageCodes.isWellFormed("en US"));
        assertFalse(LanguageCodes.isWellFormed(null));
    }
}
