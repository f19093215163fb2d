package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class AndroidStringsFormatTest {

    private final AndroidStringsFormat format = new AndroidStringsFormat(Logger.getLogger("android-test"), true);

    @Test
    void parsesStringsPluralsAndComments() {
        String xml = """
                <?xml version="1.0" encoding="utf-8"?>
                <resources>
                    <!-- App name -->
                    <string name="app_name" translatable="false">AfterCodec</string>
                    <string name="quote">Don\\'t \\"panic\\"</string>
                    <string name="empty"></string>
                    <plurals name="files">
                        <item quantity="one">%d file</item>
                        <item quantity="other">%d files</item>
                    </plurals>
                </resources>
                """;

        Resource resource = format.parse(xml.getBytes(StandardCharsets.UTF_8), ReadOptions.strict("de")).resource();

        Entry appName = resource.find("app_name", "de").orElseThrow();
        assertEquals(EntryStatus.DO_NOT_TRANSLATE, appName.status());
        assertEquals("App name", appName.comment());
        assertEquals("Don't \"panic\"", resource.find("quote", "de").orElseThrow().value().primaryText());
        assertEquals(EntryStatus.NEW, resource.find("empty", "de").orElseThrow().status());

        Translation.Plural files = (Translation.Plural) resource.find("files", "de").orElseThrow().value();
        assertEquals("%d file", files.get(PluralCategory.ONE));
        assertEquals("%d files", files.get(PluralCategory.OTHER));
    }

    @Test
    void roundTripsSingularAndPlural() {
        Resource resource = FormatTestSupport.singularAndPlural("en");

        byte[] written = format.serialize(resource, WriteOptions.strict("en")).bytes();
        Resource read = format.parse(written, ReadOptions.strict("en")).resource();

        assertEquals(resource.entries(), read.entries());
    }

    @Test
    void pluralWithoutOtherFailsStrictAndWarnsPermissive() {
        String xml = """
                <resources>
                    <plurals name="files"><item quantity="one">one</item><item quantity="lots">x</item></plurals>
                </resources>
                """;
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> format.parse(bytes, ReadOptions.strict("en")));

        ParseResult result = format.parse(bytes, ReadOptions.permissive("en"));
        assertEquals(2, result.warnings().size());
        assertEquals(1, result.resource().size());
    }

    @Test
    void rejectsWrongRootAndMalformedXml() {
        assertThrows(ResourceParseException.class, () -> format.parse(
                "<strings/>".getBytes(StandardCharsets.UTF_8), ReadOptions.strict("en")));
        assertThrows(ResourceParseException.class, () -> format.parse(
                "<resources><string name=\"a\">".getBytes(StandardCharsets.UTF_8), ReadOptions.strict("en")));
    }

    @Test
    void escapesLeadingReferenceCharacters() {
        assertEquals("\\@string/x", AndroidStringsFormat.escape("@string/x"));
        assertEquals("a &amp; b &lt;c&gt;", AndroidStringsFormat.escape("a & b <c>"));
        assertEquals("quoted  spaces", AndroidStringsFormat.unescape("\"quoted  spaces\""));
    }

    @Test
    void commentWithDashRunsStaysWellFormed() {
        Resource resource = Resource.of(List.of(
                Entry.of("k", "en", "v").withComment("see a---b-")));

        byte[] written = format.serialize(resource, WriteOptions.strict("en")).bytes();
        Entry read = format.parse(written, ReadOptions.strict("en")).resource().find("k", "en").orElseThrow();

        assertEquals("see a- - -b-", read.comment());
        assertEquals("v", read.value().primaryText());
        assertEquals("a- -b", AndroidStringsFormat.xmlComment("a--b"));
    }

    @Test
    void carriageReturnRoundTrips() {
        Resource resource = Resource.of(List.of(Entry.of("k", "en", "line\r\nnext")));

        byte[] written = format.serialize(resource, WriteOptions.strict("en")).bytes();

        assertFalse(new String(written, StandardCharsets.UTF_8).contains("\r"));
        assertEquals("line\r\nnext",
                format.parse(written, ReadOptions.strict("en")).resource().find("k", "en").orElseThrow()
                        .value().primaryText());
    }
}
