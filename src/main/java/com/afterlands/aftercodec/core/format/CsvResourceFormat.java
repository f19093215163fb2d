package com.afterlands.aftercodec.core.format;

import org.apache.commons.csv.CSVFormat;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Comma-separated key/language tables (RFC 4180 quoting, {@code \n} line ends).
 */
public class CsvResourceFormat extends AbstractTabularFormat {

    public static final String TAG = "csv";

    private static final CSVFormat DIALECT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    public CsvResourceFormat(@NotNull Logger logger, boolean debug) {
        super(logger, debug);
    }

    @Override
    @NotNull
    public String tag() {
        return TAG;
    }

    @Override
    @NotNull
    public Set<String> fileExtensions() {
        return Set.of("csv");
    }

    @Override
    @NotNull
    protected CSVFormat dialect() {
        return DIALECT;
    }
}
