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

final class AppleStringsFormatTest {

    private final AppleStringsFormat format = new AppleStringsFormat(Logger.getLogger("strings-test"), true);

    @Test
    void parsesPairsCommentsAndHeaders() {
        String text = """
                //: Language: fr
                //: Domain: Main

                /* Shown on launch */
                "welcome" = "Bienvenue\\n\\"ami\\"";
                // Button
                "ok" = "";

                // detached by the blank line

                unquoted = "Sans guillemets";
                """;

        ParseResult result = format.parse(text.getBytes(StandardCharsets.UTF_8), ReadOptions.strict(null));
        Resource resource = result.resource();

        assertEquals("Main", resource.metadata("Domain"));
        assertNull(resource.metadata("Language"));
        Entry welcome = resource.find("welcome", "fr").orElseThrow();
        assertEquals("Bienvenue\n\"ami\"", welcome.value().primaryText());
        assertEquals("Shown on launch", welcome.comment());
        Entry ok = resource.find("ok", "fr").orElseThrow();
        assertEquals("Button", ok.comment());
        assertEquals(EntryStatus.NEW, ok.status());
        assertNull(resource.find("unquoted", "fr").orElseThrow().comment());
    }

    @Test
    void roundTripsSingularValues() {
        Resource resource = Resource.of(List.of(
                Entry.of("welcome", "en", "Welcome, \"friend\"!\n\tEnjoy \\ relax").withComment("Greeting"),
                Entry.of("bye", "en", "Bye")
        ));

        SerializeResult written = format.serialize(resource, WriteOptions.strict("en"));
        Resource read = format.parse(written.bytes(), ReadOptions.strict(null)).resource();

        assertEquals(resource.entries(), read.entries());
    }

    @Test
    void strictRejectsPlurals() {
        Resource resource = FormatTestSupport.singularAndPlural("en");

        assertThrows(ResourceWriteException.class, () -> format.serialize(resource, WriteOptions.strict("en")));
    }

    @Test
    void permissiveCollapsesPluralsToOther() {
        Resource resource = FormatTestSupport.singularAndPlural("en");

        SerializeResult written = format.serialize(resource, WriteOptions.permissive("en"));

        assertTrue(written.hasWarnings());
        assertTrue(written.text().contains("\"items\" = \"%d items\";"));
    }

    @Test
    void unknownLanguageIsStrictFailure() {
        byte[] bytes = "\"k\" = \"v\";".getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> format.parse(bytes, ReadOptions.strict(null)));
        ParseResult permissive = format.parse(bytes, ReadOptions.permissive(null));
        assertEquals("und", permissive.resource().entries().get(0).language());
        assertTrue(permissive.hasWarnings());
    }

    @Test
    void permissiveSkipsMalformedPairs() {
        byte[] bytes = "\"a\" = \"1\";\n\"b\" \"2\";\n\"c\" = \"3\";".getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> format.parse(bytes, ReadOptions.strict("en")));
        ParseResult result = format.parse(bytes, ReadOptions.permissive("en"));
        assertEquals(List.of("a", "c"), List.copyOf(result.resource().keys()));
    }

    @Test
    void readsUtf16WithByteOrderMark() {
        byte[] body = "\"k\" = \"é\";".getBytes(StandardCharsets.UTF_16LE);
        byte[] bytes = new byte[body.length + 2];
        bytes[0] = (byte) 0xFF;
        bytes[1] = (byte) 0xFE;
        System.arraycopy(body, 0, bytes, 2, body.length);

        Resource resource = format.parse(bytes, ReadOptions.strict("fr")).resource();
        assertEquals("é", resource.find("k", "fr").orElseThrow().value().primaryText());
    }
}
