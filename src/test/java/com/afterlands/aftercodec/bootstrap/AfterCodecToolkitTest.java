package com.afterlands.aftercodec.bootstrap;

import com.afterlands.aftercodec.api.error.PluralValidationException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.config.AfterCodecConfig;
import com.afterlands.aftercodec.core.batch.BatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class AfterCodecToolkitTest {

    private static final String ANDROID = """
            <?xml version="1.0" encoding="utf-8"?>
            <resources>
                <string name="hello">Bonjour</string>
                <string name="bye">Au revoir</string>
            </resources>
            """;

    @TempDir
    Path dir;

    private Logger logger;
    private AfterCodecToolkit toolkit;

    @BeforeEach
    void setUp() throws IOException {
        logger = Logger.getLogger("toolkit-test");
        toolkit = AfterCodecToolkit.create(AfterCodecConfig.defaults(), logger);
    }

    @Test
    void convertAndroidToYaml() throws IOException {
        Path input = dir.resolve("strings.xml");
        Files.writeString(input, ANDROID);
        Path output = dir.resolve("out").resolve("fr.yml");

        toolkit.convert(input, output, "fr");

        Resource read = toolkit.read(output, "fr");
        assertEquals("Au revoir", read.find("bye", "fr").orElseThrow().value().primaryText());
        assertEquals(2, read.size());
    }

    @Test
    void convertAllReportsFailures() throws IOException {
        Path good = dir.resolve("strings.xml");
        Files.writeString(good, ANDROID);
        Path bad = dir.resolve("notes.txt");
        Files.writeString(bad, "hello");
        Path out = dir.resolve("converted");

        BatchResult result = toolkit.convertAll(List.of(good, bad), out, "yaml", "fr");

        assertEquals(List.of(good.toString()), result.succeeded());
        assertEquals(bad.toString(), result.failures().get(0).input());
        assertEquals(ExitCode.FAILURE, ExitCode.of(result));
        assertTrue(Files.exists(out.resolve("strings.yaml")));
    }

    @Test
    void mergeFilesUsesConfiguredStrategy() throws IOException {
        Path first = dir.resolve("a.yml");
        Path second = dir.resolve("b.yml");
        toolkit.write(first, Resource.of(List.of(Entry.of("k", "en", "first"))), null);
        toolkit.write(second, Resource.of(List.of(Entry.of("k", "en", "second"), Entry.of("j", "en", "J"))), null);

        Resource merged = toolkit.mergeFiles(List.of(first, second), dir.resolve("merged.yml"), "en");

        assertEquals("second", merged.find("k", "en").orElseThrow().value().primaryText());
        assertEquals(2, toolkit.read(dir.resolve("merged.yml"), "en").size());
    }

    @Test
    void strictPluralValidationMapsToExitCode() {
        AfterCodecToolkit strict = new AfterCodecToolkit(
                new AfterCodecConfig(Map.of("strict", true)), toolkit.getPluralTable(), logger);
        Resource resource = Resource.of(List.of(
                Entry.of("n", "en", Translation.plural(Map.of(PluralCategory.OTHER, "%d files")))));

        PluralValidationException error = assertThrows(PluralValidationException.class,
                () -> strict.validatePlurals(resource));

        assertEquals(ExitCode.PLURAL_VALIDATION, ExitCode.of(error));
        assertEquals(1, toolkit.validatePlurals(resource).issues().size());
    }

    @Test
    void statsAndRendering() {
        Resource resource = Resource.of(List.of(Entry.of("a", "en", "A"), Entry.of("a", "fr", "")));

        String json = toolkit.getRenderer().render(toolkit.stats(resource));

        assertTrue(json.contains("\"unique_keys\": 1"));
    }
}
