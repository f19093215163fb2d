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
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class XcstringsFormatTest {

    private static final String CATALOG = """
            {
              "sourceLanguage" : "en",
              "strings" : {
                "greeting" : {
                  "comment" : "Shown on launch",
                  "extractionState" : "manual",
                  "localizations" : {
                    "en" : { "stringUnit" : { "state" : "translated", "value" : "Hello" } },
                    "fr" : { "stringUnit" : { "state" : "needs_review", "value" : "Bonjour" } }
                  }
                },
                "items" : {
                  "localizations" : {
                    "en" : { "variations" : { "plural" : {
                      "one" : { "stringUnit" : { "state" : "translated", "value" : "%lld item" } },
                      "other" : { "stringUnit" : { "state" : "translated", "value" : "%lld items" } }
                    } } }
                  }
                },
                "brand" : {
                  "shouldTranslate" : false,
                  "localizations" : {
                    "en" : { "stringUnit" : { "state" : "translated", "value" : "AfterCodec" } }
                  }
                },
                "untouched" : { }
              },
              "version" : "1.0"
            }
            """;

    private final XcstringsFormat format = new XcstringsFormat(Logger.getLogger("xcstrings-test"), true);

    @Test
    void parsesCatalog() {
        Resource resource = format.parse(CATALOG.getBytes(StandardCharsets.UTF_8), ReadOptions.strict(null)).resource();

        assertEquals("en", resource.metadata(Resource.SOURCE_LANGUAGE));
        assertEquals("1.0", resource.metadata(Resource.FORMAT_VERSION));

        Entry fr = resource.find("greeting", "fr").orElseThrow();
        assertEquals("Bonjour", fr.value().primaryText());
        assertEquals(EntryStatus.NEEDS_REVIEW, fr.status());
        assertEquals("Shown on launch", fr.comment());
        assertEquals("manual", fr.custom().get(XcstringsFormat.EXTRACTION_STATE));

        Translation.Plural items = (Translation.Plural) resource.find("items", "en").orElseThrow().value();
        assertEquals("%lld item", items.get(PluralCategory.ONE));

        assertEquals(EntryStatus.DO_NOT_TRANSLATE, resource.find("brand", "en").orElseThrow().status());

        Entry untouched = resource.find("untouched", "en").orElseThrow();
        assertEquals(EntryStatus.NEW, untouched.status());
        assertEquals("", untouched.value().primaryText());
    }

    @Test
    void roundTripsCatalog() {
        Resource resource = format.parse(CATALOG.getBytes(StandardCharsets.UTF_8), ReadOptions.strict(null)).resource();

        byte[] written = format.serialize(resource, WriteOptions.strict(null)).bytes();
        Resource read = format.parse(written, ReadOptions.strict(null)).resource();

        assertEquals(resource, read);
    }

    @Test
    void unknownStateIsAnomaly() {
        String json = """
                {"sourceLanguage":"en","strings":{"k":{"localizations":{
                  "en":{"stringUnit":{"state":"approved","value":"x"}}}}}}
                """;
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> format.parse(bytes, ReadOptions.strict(null)));
        ParseResult result = format.parse(bytes, ReadOptions.permissive(null));
        assertEquals(EntryStatus.TRANSLATED, result.resource().find("k", "en").orElseThrow().status());
        assertTrue(result.hasWarnings());
    }

    @Test
    void missingSourceLanguageUsesHint() {
        String json = "{\"strings\":{\"k\":{}}}";

        Resource resource = format.parse(json.getBytes(StandardCharsets.UTF_8), ReadOptions.strict("de")).resource();

        assertEquals("de", resource.metadata(Resource.SOURCE_LANGUAGE));
        assertTrue(resource.find("k", "de").isPresent());
        assertThrows(ResourceParseException.class,
                () -> format.parse(json.getBytes(StandardCharsets.UTF_8), ReadOptions.strict(null)));
    }

    @Test
    void malformedJsonIsParseError() {
        assertThrows(ResourceParseException.class,
                () -> format.parse("{\"strings\": ".getBytes(StandardCharsets.UTF_8), ReadOptions.strict("en")));
        assertThrows(ResourceParseException.class,
                () -> format.parse("[]".getBytes(StandardCharsets.UTF_8), ReadOptions.strict("en")));
    }

    @Test
    void nonBooleanFlagsAreAnomalies() {
        byte[] nullFlag = "{\"sourceLanguage\":\"en\",\"strings\":{\"k\":{\"shouldTranslate\":null}}}"
                .getBytes(StandardCharsets.UTF_8);
        byte[] objectFlag = "{\"sourceLanguage\":\"en\",\"strings\":{\"k\":{\"isCommentAutoGenerated\":{}}}}"
                .getBytes(StandardCharsets.UTF_8);

        assertThrows(ResourceParseException.class, () -> format.parse(nullFlag, ReadOptions.strict(null)));
        assertThrows(ResourceParseException.class, () -> format.parse(objectFlag, ReadOptions.strict(null)));

        ParseResult result = format.parse(nullFlag, ReadOptions.permissive(null));
        assertTrue(result.hasWarnings());
        assertEquals(EntryStatus.NEW, result.resource().find("k", "en").orElseThrow().status());
        assertFalse(format.parse(objectFlag, ReadOptions.permissive(null)).resource()
                .find("k", "en").orElseThrow().custom().containsKey(XcstringsFormat.COMMENT_AUTO_GENERATED));
    }
}
