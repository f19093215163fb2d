package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderNormalizerTest {

    private final PlaceholderNormalizer normalizer = new PlaceholderNormalizer(Logger.getLogger("normalizer-test"));

    @Test
    void rewritesToAndroidStyle() {
        assertEquals("Hi %1$s, %2$d left, %s", PlaceholderNormalizer.normalize("Hi %1$@, %2$ld left, %@", PlaceholderStyle.ANDROID));
        assertEquals("%5.2f%%", PlaceholderNormalizer.normalize("%5.2f%%", PlaceholderStyle.ANDROID));
    }

    @Test
    void rewritesToAppleStyle() {
        assertEquals("Hi %1$@, %lld", PlaceholderNormalizer.normalize("Hi %1$s, %lld", PlaceholderStyle.APPLE));
    }

    @Test
    void leavesMismatchingEntriesUntouched() {
        Resource resource = Resource.of(List.of(
                Entry.of("a", "en", "Hello %@"),
                Entry.of("a", "fr", "Bonjour %@ %d"),
                Entry.of("b", "fr", "Salut %@")
        ));

        PlaceholderNormalizer.Result result = normalizer.normalize(resource, PlaceholderStyle.ANDROID, "en");

        assertEquals("Hello %s", result.resource().find("a", "en").orElseThrow().value().primaryText());
        assertEquals("Bonjour %@ %d", result.resource().find("a", "fr").orElseThrow().value().primaryText());
        assertEquals("Salut %s", result.resource().find("b", "fr").orElseThrow().value().primaryText());
        assertEquals(2, result.rewritten());
        assertEquals(1, result.unresolved().size());
    }
}
