package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.UnknownFormatException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class FormatRegistryTest {

    private final FormatRegistry registry = FormatRegistry.defaults(Logger.getLogger("registry-test"), false);

    @Test
    void resolvesByTagAndExtension() {
        assertEquals(AndroidStringsFormat.TAG, registry.get("Android").tag());
        assertEquals(YamlResourceFormat.TAG, registry.forPath(Path.of("lang", "pt_br", "messages.yaml")).tag());
        assertEquals(AppleStringsFormat.TAG, registry.forPath(Path.of("fr.lproj/Localizable.strings")).tag());
        assertEquals(XcstringsFormat.TAG, registry.forPath(Path.of("Localizable.xcstrings")).tag());
        assertEquals(CsvResourceFormat.TAG, registry.forPath(Path.of("export.CSV")).tag());
        assertEquals(TsvResourceFormat.TAG, registry.get("tsv").tag());
        assertTrue(registry.findByExtension(".yml").isPresent());
    }

    @Test
    void unknownFormatsThrow() {
        assertThrows(UnknownFormatException.class, () -> registry.get("po"));
        assertThrows(UnknownFormatException.class, () -> registry.forPath(Path.of("messages.po")));
        assertThrows(UnknownFormatException.class, () -> registry.forPath(Path.of("Makefile")));
    }

    @Test
    void laterRegistrationReplacesTag() {
        YamlResourceFormat replacement = new YamlResourceFormat(Logger.getLogger("registry-test"), false);
        registry.register(replacement);

        assertSame(replacement, registry.get("yaml"));
        assertSame(replacement, registry.forPath(Path.of("a.yml")));
        assertEquals(6, registry.formats().size());
    }
}
