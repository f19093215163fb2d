package com.afterlands.aftercodec.core.merge;

import com.afterlands.aftercodec.api.error.InvalidResourceException;
import com.afterlands.aftercodec.api.error.MergeConflict;
import com.afterlands.aftercodec.api.error.MergeConflictException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class MergeEngineTest {

    private MergeEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MergeEngine(Logger.getLogger("merge-test"), true);
    }

    @Test
    void unionKeepsEveryKeyPerLanguage() {
        Resource a = Resource.of(List.of(Entry.of("hello", "en", "Hello"), Entry.of("bye", "en", "Bye")));
        Resource b = Resource.of(List.of(Entry.of("hello", "fr", "Bonjour"), Entry.of("thanks", "en", "Thanks")));

        Resource merged = engine.merge(List.of(a, b), MergeStrategy.LAST);

        assertEquals(4, merged.size());
        assertEquals(List.of("hello", "bye", "thanks"), List.copyOf(merged.keys()));
        assertEquals("Bonjour", merged.find("hello", "fr").orElseThrow().value().primaryText());
    }

    @Test
    void lastWinsAndFirstWins() {
        Resource first = Resource.of(List.of(Entry.of("k", "en", "old")));
        Resource second = Resource.of(List.of(Entry.of("k", "en", "new")));

        assertEquals("new", engine.merge(List.of(first, second), MergeStrategy.LAST)
                .find("k", "en").orElseThrow().value().primaryText());
        assertEquals("old", engine.merge(List.of(first, second), MergeStrategy.FIRST)
                .find("k", "en").orElseThrow().value().primaryText());
    }

    @Test
    void errorStrategyListsEveryConflict() {
        Resource first = Resource.of(List.of(Entry.of("k", "en", "old"), Entry.of("same", "en", "x")));
        Resource second = Resource.of(List.of(Entry.of("k", "en", "new"), Entry.of("same", "en", "x")));

        MergeConflictException e = assertThrows(MergeConflictException.class,
                () -> engine.merge(List.of(first, second), MergeStrategy.ERROR));

        assertEquals(1, e.getConflicts().size());
        MergeConflict conflict = e.getConflicts().get(0);
        assertEquals("k", conflict.key());
        assertEquals("en", conflict.language());
        assertEquals(List.of(Translation.singular("old"), Translation.singular("new")), conflict.values());
    }

    @Test
    void equalValuesAreNotAConflict() {
        Resource first = Resource.of(List.of(Entry.of("k", "en", "same")));
        Resource second = Resource.of(List.of(Entry.of("k", "en", "same")));

        Resource merged = engine.merge(List.of(first, second), MergeStrategy.ERROR);
        assertEquals(1, merged.size());
    }

    @Test
    void statusAloneIsNotAConflict() {
        Resource first = Resource.of(List.of(Entry.of("k", "en", "same")));
        Resource second = Resource.of(List.of(Entry.of("k", "en", "same").withStatus(EntryStatus.NEEDS_REVIEW)));

        assertEquals(EntryStatus.TRANSLATED, engine.merge(List.of(first, second), MergeStrategy.ERROR)
                .find("k", "en").orElseThrow().status());
        assertEquals(EntryStatus.NEEDS_REVIEW, engine.merge(List.of(first, second), MergeStrategy.LAST)
                .find("k", "en").orElseThrow().status());
    }

    @Test
    void metadataFromFirstInputWins() {
        Resource first = new Resource(Map.of("source_language", "en"), List.of());
        Resource second = new Resource(Map.of("source_language", "fr", "domain", "app"), List.of());

        Resource merged = engine.merge(List.of(first, second), MergeStrategy.LAST);

        assertEquals("en", merged.metadata("source_language"));
        assertEquals("app", merged.metadata("domain"));
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(InvalidResourceException.class, () -> engine.merge(List.of(), MergeStrategy.LAST));
    }

    @Test
    void strategyParsesCaseInsensitively() {
        assertEquals(MergeStrategy.ERROR, MergeStrategy.fromKey("Error"));
        assertNull(MergeStrategy.fromKey("newest"));
    }
}
