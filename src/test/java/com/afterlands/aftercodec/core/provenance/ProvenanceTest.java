package com.afterlands.aftercodec.core.provenance;

import com.afterlands.aftercodec.api.model.Entry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ProvenanceTest {

    @Test
    void applyAndReadBack() {
        Entry entry = Entry.of("k", "fr", "Oui").withCustom(Map.of("owner", "ui"));

        Entry tagged = Provenance.ofMatch("exact_key", "k", "fr").applyTo(entry);

        assertEquals("ui", tagged.custom().get("owner"));
        assertEquals("exact_key", tagged.custom().get(Provenance.MATCH_STRATEGY));
        Provenance read = Provenance.of(tagged).orElseThrow();
        assertEquals("k", read.sourceKey());
        assertEquals("fr", read.sourceLanguage());
        assertNull(read.sourcePath());
    }

    @Test
    void nullFieldsClearStaleKeys() {
        Entry tagged = Provenance.ofMatch("fallback_translation", "old", "en").applyTo(Entry.of("k", "fr", "x"));

        Entry retagged = Provenance.ofFile("a.yml", "yaml").applyTo(tagged);

        assertFalse(retagged.custom().containsKey(Provenance.SOURCE_KEY));
        assertEquals("a.yml", retagged.custom().get(Provenance.SOURCE_PATH));
    }

    @Test
    void stripAndAbsence() {
        Entry plain = Entry.of("k", "fr", "x").withCustom(Map.of("owner", "ui"));
        Entry tagged = Provenance.ofFile("a.xml", "android").applyTo(plain);

        assertEquals(Map.of("owner", "ui"), Provenance.strip(tagged.custom()));
        assertTrue(Provenance.of(plain).isEmpty());
        assertTrue(new Provenance(null, null, null, null, null).isEmpty());
    }
}
