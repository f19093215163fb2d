package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.error.ResourceWriteException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.Resource;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class TabularFormatTest {

    private static final Logger LOGGER = Logger.getLogger("tabular-test");

    private final CsvResourceFormat csv = new CsvResourceFormat(LOGGER, true);
    private final TsvResourceFormat tsv = new TsvResourceFormat(LOGGER, true);

    private static Resource multiLanguage() {
        return Resource.of(List.of(
                Entry.of("welcome", "en", "Welcome, \"friend\"!\nEnjoy"),
                Entry.of("welcome", "fr", "Bienvenue\tami"),
                Entry.of("bye", "en", "Bye")
        ));
    }

    @Test
    void csvRoundTripsLanguages() {
        Resource resource = multiLanguage();

        SerializeResult written = csv.serialize(resource, WriteOptions.strict(null));
        Resource read = csv.parse(written.bytes(), ReadOptions.strict(null)).resource();

        assertTrue(written.text().startsWith("key,en,fr\n"));
        assertEquals(resource.entries(), read.entries());
        assertTrue(read.find("bye", "fr").isEmpty());
    }

    @Test
    void tsvRoundTripsLanguages() {
        Resource resource = multiLanguage();

        byte[] written = tsv.serialize(resource, WriteOptions.strict(null)).bytes();
        Resource read = tsv.parse(written, ReadOptions.strict(null)).resource();

        assertTrue(new String(written, StandardCharsets.UTF_8).startsWith("key\ten\tfr\n"));
        assertEquals(resource.entries(), read.entries());
    }

    @Test
    void pluralsCollapseOrFail() {
        Resource resource = FormatTestSupport.singularAndPlural("en");

        assertThrows(ResourceWriteException.class, () -> csv.serialize(resource, WriteOptions.strict(null)));

        SerializeResult written = tsv.serialize(resource, WriteOptions.permissive(null));
        assertTrue(written.hasWarnings());
        Resource read = tsv.parse(written.bytes(), ReadOptions.strict(null)).resource();
        assertEquals("%d items", read.find("items", "en").orElseThrow().value().primaryText());
    }

    @Test
    void headerlessPairsUseHintLanguage() {
        byte[] bytes = "hello,Hello\nempty,\n".getBytes(StandardCharsets.UTF_8);

        Resource resource = csv.parse(bytes, ReadOptions.strict("de")).resource();

        assertEquals("Hello", resource.find("hello", "de").orElseThrow().value().primaryText());
        Entry empty = resource.find("empty", "de").orElseThrow();
        assertEquals(EntryStatus.NEW, empty.status());
        assertThrows(ResourceParseException.class, () -> csv.parse(bytes, ReadOptions.strict(null)));
    }

    @Test
    void rowAnomaliesFailStrictAndWarnPermissive() {
        byte[] bytes = "key,en\na,A\na,again\n,orphan\nb,B,extra\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> csv.parse(bytes, ReadOptions.strict(null)));

        ParseResult result = csv.parse(bytes, ReadOptions.permissive(null));
        assertEquals(3, result.warnings().size());
        assertEquals("A", result.resource().find("a", "en").orElseThrow().value().primaryText());
        assertEquals("B", result.resource().find("b", "en").orElseThrow().value().primaryText());
    }

    @Test
    void writesOnlyRequestedLanguage() {
        String text = csv.serialize(multiLanguage(), WriteOptions.strict("FR")).text();

        assertEquals("key,fr\nwelcome,Bienvenue\tami\n", text);
    }

    @Test
    void unterminatedQuoteIsParseError() {
        assertThrows(ResourceParseException.class, () -> csv.parse(
                "key,en\na,\"open".getBytes(StandardCharsets.UTF_8), ReadOptions.permissive(null)));
    }
}
