package com.afterlands.aftercodec.core.format;

import org.apache.commons.csv.CSVFormat;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Tab-separated key/language tables.
 *
 * <p>Cells holding a tab, a quote or a line break are quoted as in CSV. Surrounding
 * spaces are kept.</p>
 */
public class TsvResourceFormat extends AbstractTabularFormat {

    public static final String TAG = "tsv";

    private static final CSVFormat DIALECT = CSVFormat.DEFAULT.builder()
            .setDelimiter('\t')
            .setRecordSeparator("\n")
            .build();

    public TsvResourceFormat(@NotNull Logger logger, boolean debug) {
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
        return Set.of("tsv");
    }

    @Override
    @NotNull
    protected CSVFormat dialect() {
        return DIALECT;
    }
}
