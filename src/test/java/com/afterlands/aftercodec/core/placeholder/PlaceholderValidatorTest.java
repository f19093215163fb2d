package com.afterlands.aftercodec.core.placeholder;

import com.afterlands.aftercodec.api.error.PlaceholderValidationException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PlaceholderType;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.report.PlaceholderIssue;
import com.afterlands.aftercodec.api.report.PlaceholderValidationReport;
import com.afterlands.aftercodec.api.report.ValidationMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderValidatorTest {

    private PlaceholderValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PlaceholderValidator(Logger.getLogger("placeholder-test"));
    }

    @Test
    void reportsMissingInteger() {
        Resource resource = Resource.of(List.of(
                Entry.of("inbox", "en", "Hello %1$@, you have %d items"),
                Entry.of("inbox", "fr", "Bonjour %1$@")
        ));

        PlaceholderValidationReport report = validator.validate(resource, ValidationMode.PERMISSIVE);

        assertEquals("en", report.sourceLanguage());
        assertEquals(1, report.issues().size());
        PlaceholderIssue issue = report.issues().get(0);
        assertEquals("fr", issue.language());
        assertEquals(Map.of(2, PlaceholderType.INTEGER), issue.missing());
        assertTrue(issue.extra().isEmpty());
    }

    @Test
    void crossStyleTokensWithSameTypesMatch() {
        Resource resource = Resource.of(List.of(
                Entry.of("greet", "en", "Hi %@, %ld new"),
                Entry.of("greet", "de", "Hallo %s, %d neu")
        ));

        assertTrue(validator.validate(resource, ValidationMode.STRICT).isClean());
    }

    @Test
    void typeChangeIsReported() {
        Resource resource = Resource.of(List.of(
                Entry.of("price", "en", "Total: %.2f"),
                Entry.of("price", "es", "Total: %d")
        ));

        PlaceholderIssue issue = validator.validate(resource, ValidationMode.PERMISSIVE).issues().get(0);
        assertEquals(List.of(1), issue.typeChanged());
    }

    @Test
    void strictThrows() {
        Resource resource = new Resource(Map.of(Resource.SOURCE_LANGUAGE, "de"), List.of(
                Entry.of("k", "de", "%s"),
                Entry.of("k", "en", "none")
        ));

        PlaceholderValidationException e = assertThrows(PlaceholderValidationException.class,
                () -> validator.validate(resource, ValidationMode.STRICT));
        assertEquals("de", e.getReport().sourceLanguage());
    }

    @Test
    void percentLiteralIsNotAPlaceholder() {
        assertTrue(PlaceholderExtractor.signature("100%% sure, 50% off").isEmpty());
        assertEquals(Map.of(1, PlaceholderType.STRING, 2, PlaceholderType.UNSIGNED),
                PlaceholderExtractor.signature("%2$lu of %1$@").arguments());
    }

    @Test
    void oversizedPositionStaysLiteral() {
        Resource resource = Resource.of(List.of(
                Entry.of("k", "en", "50%99999999999$s off"),
                Entry.of("k", "fr", "x")
        ));

        PlaceholderValidationReport report = validator.validate(resource, ValidationMode.PERMISSIVE);

        assertTrue(report.issues().isEmpty());
        assertTrue(PlaceholderExtractor.signature("50%99999999999$s off").isEmpty());
        assertEquals(Map.of(123456789, PlaceholderType.STRING),
                PlaceholderExtractor.signature("%123456789$s").arguments());
    }
}
