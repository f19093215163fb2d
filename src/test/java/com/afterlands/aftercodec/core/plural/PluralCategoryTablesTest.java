package com.afterlands.aftercodec.core.plural;

import com.afterlands.aftercodec.api.model.PluralCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

final class PluralCategoryTablesTest {

    @Test
    void bundledTableResolvesExactThenBaseThenDefault() {
        MapPluralCategoryTable table = PluralCategoryTables.bundled();

        assertEquals(EnumSet.of(PluralCategory.ONE, PluralCategory.FEW, PluralCategory.MANY, PluralCategory.OTHER),
                table.requiredCategories("ru"));
        assertEquals(EnumSet.of(PluralCategory.ONE, PluralCategory.OTHER), table.requiredCategories("pt_BR"));
        assertEquals(EnumSet.of(PluralCategory.OTHER), table.requiredCategories("tlh"));
        assertTrue(table.isKnown("no"));
    }

    @Test
    void parsesGroupsAndLanguageOverrides() {
        String yaml = """
                default: [one, other]
                groups:
                  - categories: [other]
                    languages: [ja]
                languages:
                  cy: [zero, one, two, few, many, other]
                """;

        MapPluralCategoryTable table = PluralCategoryTables.parse(new StringReader(yaml), "inline");

        assertEquals(EnumSet.of(PluralCategory.OTHER), table.requiredCategories("ja"));
        assertEquals(6, table.requiredCategories("cy").size());
        assertEquals(EnumSet.of(PluralCategory.ONE, PluralCategory.OTHER), table.requiredCategories("xx"));
    }

    @Test
    void rejectsUnknownCategory() {
        assertThrows(IllegalArgumentException.class,
                () -> PluralCategoryTables.parse(new StringReader("languages:\n  en: [single]\n"), "inline"));
    }

    @Test
    void overridesLayOverBundledTable(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("plurals.yml");
        Files.writeString(file, "languages:\n  en: [one, two, other]\n");

        MapPluralCategoryTable table = PluralCategoryTables.bundledWithOverrides(file);

        assertEquals(EnumSet.of(PluralCategory.ONE, PluralCategory.TWO, PluralCategory.OTHER),
                table.requiredCategories("en"));
        assertEquals(EnumSet.of(PluralCategory.ONE, PluralCategory.FEW, PluralCategory.OTHER),
                table.requiredCategories("cs"));
    }
}
