package com.afterlands.aftercodec.bootstrap;

import com.afterlands.aftercodec.api.error.InvalidResourceException;
import com.afterlands.aftercodec.api.error.PluralValidationException;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.api.report.ValidationMode;
import com.afterlands.aftercodec.core.batch.BatchResult;
import com.afterlands.aftercodec.core.plural.PluralCategoryTables;
import com.afterlands.aftercodec.core.plural.PluralValidator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class ExitCodeTest {

    @Test
    void codes() {
        assertEquals(0, ExitCode.SUCCESS.getCode());
        assertEquals(1, ExitCode.FAILURE.getCode());
        assertEquals(2, ExitCode.PLURAL_VALIDATION.getCode());
    }

    @Test
    void fromThrowable() {
        assertEquals(ExitCode.PLURAL_VALIDATION, ExitCode.of(pluralFailure()));
        assertEquals(ExitCode.FAILURE, ExitCode.of(new InvalidResourceException("bad")));
        assertEquals(ExitCode.FAILURE, ExitCode.of(new IOException("disk")));
    }

    @Test
    void fromBatch() {
        BatchResult.Failure plural = new BatchResult.Failure("a", pluralFailure());
        BatchResult.Failure io = new BatchResult.Failure("b", new IOException("disk"));

        assertEquals(ExitCode.SUCCESS, ExitCode.of(new BatchResult(List.of("a"), List.of())));
        assertEquals(ExitCode.PLURAL_VALIDATION, ExitCode.of(new BatchResult(List.of(), List.of(plural))));
        assertEquals(ExitCode.FAILURE, ExitCode.of(new BatchResult(List.of(), List.of(plural, io))));
    }

    private static PluralValidationException pluralFailure() {
        Resource resource = Resource.of(List.of(
                Entry.of("n", "en", Translation.plural(Map.of(PluralCategory.OTHER, "%d")))));
        PluralValidator validator = new PluralValidator(PluralCategoryTables.bundled(), Logger.getLogger("exit-test"));
        return assertThrows(PluralValidationException.class, () -> validator.validate(resource, ValidationMode.STRICT));
    }
}
