package com.afterlands.aftercodec.core.stats;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.core.plural.PluralCategoryTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class StatsCalculatorTest {

    private StatsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new StatsCalculator(PluralCategoryTables.bundled(), Logger.getLogger("stats-test"));
    }

    @Test
    void completionExcludesDoNotTranslate() {
        Resource resource = Resource.of(List.of(
                Entry.of("a", "fr", "A"),
                Entry.of("b", "fr", "B").withStatus(EntryStatus.NEEDS_REVIEW),
                Entry.of("c", "fr", "").withStatus(EntryStatus.NEW),
                Entry.of("brand", "fr", "AfterCodec").withStatus(EntryStatus.DO_NOT_TRANSLATE)
        ));

        LanguageStats fr = calculator.calculate(resource).language("fr").orElseThrow();

        assertEquals(4, fr.total());
        assertEquals(33.33, fr.completionPercent());
        assertEquals(1, fr.count(EntryStatus.DO_NOT_TRANSLATE));
        assertEquals(0, fr.count(EntryStatus.STALE));
    }

    @Test
    void nothingToTranslateIsComplete() {
        Resource resource = Resource.of(List.of(
                Entry.of("brand", "en", "X").withStatus(EntryStatus.DO_NOT_TRANSLATE)));

        assertEquals(100.0, calculator.calculate(resource).languages().get(0).completionPercent());
    }

    @Test
    void countsMissingPluralCategoriesAndSortsLanguages() {
        Resource resource = Resource.of(List.of(
                Entry.of("n", "ru", Translation.plural(Map.of(PluralCategory.OTHER, "x"))),
                Entry.of("n", "en", Translation.plural(Map.of(PluralCategory.ONE, "1", PluralCategory.OTHER, "x")))
        ));

        ResourceStats stats = calculator.calculate(resource);

        assertEquals(List.of("en", "ru"), stats.languages().stream().map(LanguageStats::language).toList());
        LanguageStats ru = stats.language("ru").orElseThrow();
        assertEquals(1, ru.missingPluralEntries());
        assertEquals(3, ru.missingPluralCategories());
        assertTrue(stats.language("en").orElseThrow().isComplete());
        assertEquals(1, stats.uniqueKeys());
    }

    @Test
    void languageFilter() {
        Resource resource = Resource.of(List.of(Entry.of("a", "pt_BR", "x"), Entry.of("a", "en", "y")));

        ResourceStats stats = calculator.calculate(resource, "pt-br");

        assertEquals(1, stats.languages().size());
        assertEquals("pt_BR", stats.languages().get(0).language());
    }
}
