package com.afterlands.aftercodec.core.sync;

import com.afterlands.aftercodec.api.error.SyncPolicyException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.LanguageSyncSummary;
import com.afterlands.aftercodec.api.report.SyncIssue;
import com.afterlands.aftercodec.api.report.SyncIssueKind;
import com.afterlands.aftercodec.core.provenance.Provenance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class SyncEngineTest {

    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SyncEngine(Logger.getLogger("sync-test"), true);
    }

    @Test
    void neverAddsOrRemovesTargetKeys() {
        Resource source = Resource.of(List.of(
                Entry.of("welcome", "en", "Welcome"),
                Entry.of("welcome", "fr", "Bienvenue"),
                Entry.of("extra", "fr", "En plus")
        ));
        Resource target = Resource.of(List.of(
                Entry.of("welcome", "fr", "Salut"),
                Entry.of("unknown", "fr", "Inconnu")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults());

        assertEquals(List.of("welcome", "unknown"),
                result.resource().entries().stream().map(Entry::key).toList());
        assertEquals("Bienvenue", result.resource().find("welcome", "fr").orElseThrow().value().primaryText());
        assertEquals("Inconnu", result.resource().find("unknown", "fr").orElseThrow().value().primaryText());
        assertEquals(List.of("unknown"), result.report().languages().get("fr").unmatched());
        assertTrue(result.isSuccess());
    }

    @Test
    void exactMatchTakesPrecedenceOverFallback() {
        Resource source = Resource.of(List.of(
                Entry.of("greeting", "en", "Hello"),
                Entry.of("greeting", "fr", "Bonjour"),
                Entry.of("hello_alias", "en", "Hello"),
                Entry.of("hello_alias", "fr", "Salut")
        ));
        Resource target = Resource.of(List.of(
                Entry.of("greeting", "en", "Hello"),
                Entry.of("greeting", "fr", "old")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults().withRecordProvenance(true));

        Entry synced = result.resource().find("greeting", "fr").orElseThrow();
        assertEquals("Bonjour", synced.value().primaryText());
        Provenance provenance = Provenance.of(synced).orElseThrow();
        assertEquals(SyncEngine.EXACT_KEY, provenance.matchStrategy());
        assertEquals("greeting", provenance.sourceKey());
        assertEquals(0, result.report().totalFallbackMatches());
    }

    @Test
    void fallbackMatchesBySiblingTranslation() {
        Resource source = Resource.of(List.of(
                Entry.of("btn_ok", "en", "OK"),
                Entry.of("btn_ok", "de", "Okay")
        ));
        Resource target = Resource.of(List.of(
                Entry.of("ok_button", "en", "OK"),
                Entry.of("ok_button", "de", "alt")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults().withRecordProvenance(true));

        Entry synced = result.resource().find("ok_button", "de").orElseThrow();
        assertEquals("Okay", synced.value().primaryText());
        assertEquals(SyncEngine.FALLBACK_TRANSLATION, Provenance.of(synced).orElseThrow().matchStrategy());
        assertEquals("btn_ok", Provenance.of(synced).orElseThrow().sourceKey());

        LanguageSyncSummary de = result.report().languages().get("de");
        assertEquals(1, de.updated());
        assertEquals(1, de.fallbackMatches());
    }

    @Test
    void ambiguousFallbackIsReportedAndLeftAlone() {
        Resource source = Resource.of(List.of(
                Entry.of("a", "en", "Save"),
                Entry.of("a", "de", "Speichern"),
                Entry.of("b", "en", "Save"),
                Entry.of("b", "de", "Sichern")
        ));
        Resource target = Resource.of(List.of(
                Entry.of("save", "en", "Save"),
                Entry.of("save", "de", "alt")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults().withFailOnAmbiguous(true));

        assertEquals("alt", result.resource().find("save", "de").orElseThrow().value().primaryText());
        SyncIssue issue = result.report().issues().stream()
                .filter(i -> i.kind() == SyncIssueKind.AMBIGUOUS && i.language().equals("de"))
                .findFirst().orElseThrow();
        assertEquals(List.of("a", "b"), issue.candidates());
        assertFalse(result.isSuccess());
        assertThrows(SyncPolicyException.class, result::orThrow);
    }

    @Test
    void unmatchedEntryFailsWhenPolicyAsks() {
        Resource source = Resource.of(List.of(Entry.of("hello", "fr", "Bonjour")));
        Resource target = Resource.of(List.of(
                Entry.of("hello", "fr", "Salut"),
                Entry.of("orphan", "fr", "Seul")
        ));

        SyncResult lenient = engine.sync(source, target, SyncOptions.defaults());
        assertTrue(lenient.isSuccess());

        SyncResult result = engine.sync(source, target, SyncOptions.defaults().withFailOnUnmatched(true));

        assertFalse(result.policyViolations().isEmpty());
        assertThrows(SyncPolicyException.class, result::orThrow);
        assertEquals("Seul", result.resource().find("orphan", "fr").orElseThrow().value().primaryText());
        assertEquals("Bonjour", result.resource().find("hello", "fr").orElseThrow().value().primaryText());
        assertEquals(List.of("orphan"), result.report().languages().get("fr").unmatched());
    }

    @Test
    void ambiguityNarrowsToCandidatesWithTargetLanguage() {
        Resource source = Resource.of(List.of(
                Entry.of("a", "en", "Save"),
                Entry.of("a", "de", "Speichern"),
                Entry.of("b", "en", "Save")
        ));
        Resource target = Resource.of(List.of(
                Entry.of("save", "en", "Save"),
                Entry.of("save", "de", "alt")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults());

        assertEquals("Speichern", result.resource().find("save", "de").orElseThrow().value().primaryText());
    }

    @Test
    void reportsMissingLanguageAndTypeMismatch() {
        Resource source = Resource.of(List.of(
                Entry.of("only_en", "en", "Only"),
                Entry.of("count", "en", Translation.plural(Map.of(PluralCategory.OTHER, "%d"))),
                Entry.of("count", "fr", Translation.plural(Map.of(PluralCategory.OTHER, "%d")))
        ));
        Resource target = Resource.of(List.of(
                Entry.of("only_en", "fr", "Seul"),
                Entry.of("count", "fr", "%d")
        ));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults());

        assertEquals(1, result.report().count(SyncIssueKind.MISSING_LANGUAGE));
        assertEquals(1, result.report().count(SyncIssueKind.TYPE_MISMATCH));
        assertEquals(target, result.resource());
    }

    @Test
    void languageFilterSkipsOtherLanguages() {
        Resource source = Resource.of(List.of(Entry.of("k", "fr", "Oui"), Entry.of("k", "de", "Ja")));
        Resource target = Resource.of(List.of(Entry.of("k", "fr", "non"), Entry.of("k", "de", "nein")));

        SyncResult result = engine.sync(source, target, SyncOptions.defaults().withLanguageFilter("fr"));

        assertEquals("Oui", result.resource().find("k", "fr").orElseThrow().value().primaryText());
        assertEquals("nein", result.resource().find("k", "de").orElseThrow().value().primaryText());
        assertFalse(result.report().languages().containsKey("de"));
    }

    @Test
    void matchLanguageInference() {
        Resource declared = new Resource(Map.of(Resource.SOURCE_LANGUAGE, "fr"), List.of(Entry.of("k", "en", "x")));
        Resource withEnglish = Resource.of(List.of(Entry.of("k", "de", "x"), Entry.of("k", "en-US", "x")));
        Resource noEnglish = Resource.of(List.of(Entry.of("k", "de", "x")));

        assertEquals("es", SyncEngine.inferMatchLanguage(declared, "es"));
        assertEquals("fr", SyncEngine.inferMatchLanguage(declared, null));
        assertEquals("de", SyncEngine.inferMatchLanguage(noEnglish, null));
        assertEquals("en", SyncEngine.inferMatchLanguage(Resource.empty(), null));
        assertEquals("en-US", SyncEngine.resolveLanguage(withEnglish.languages(), "en"));
    }
}
