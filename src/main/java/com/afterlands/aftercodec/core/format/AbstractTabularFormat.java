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
import com.afterlands.aftercodec.api.model.Translation;
import com.afterlands.aftercodec.core.language.LanguageCodes;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Key/language tables: one row per key, one column per language.
 *
 * <h3>Layout:</h3>
 * <pre>
 * key,en,fr
 * welcome,Welcome!,Bienvenue !
 * bye,Bye,
 * </pre>
 *
 * <ul>
 *     <li>a first row starting with {@code key} is the header; each further cell names a language</li>
 *     <li>an empty cell means the key has no entry in that language</li>
 *     <li>without a header the table is {@code key,value} pairs in the language of the read
 *     options; an empty value there is a NEW entry</li>
 *     <li>every value read is a Singular; status other than NEW/TRANSLATED, comments and
 *     custom data are not stored</li>
 *     <li>plurals collapse to their {@code other} form (strict writes fail)</li>
 * </ul>
 *
 * <p>Writing always emits a header. Languages follow their first appearance in the
 * resource, keys follow resource order.</p>
 */
public abstract class AbstractTabularFormat extends AbstractResourceFormat {

    static final String KEY_COLUMN = "key";

    protected AbstractTabularFormat(@NotNull Logger logger, boolean debug) {
        super(logger, debug);
    }

    /**
     * Dialect used to read and write the table.
     */
    @NotNull
    protected abstract CSVFormat dialect();

    @Override
    public boolean supportsPlurals() {
        return false;
    }

    @Override
    public boolean multiLanguage() {
        return true;
    }

    // ══════════════════════════════════════════════
    // PARSE
    // ══════════════════════════════════════════════

    @Override
    @NotNull
    public ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options) {
        List<String> warnings = new ArrayList<>();
        List<CSVRecord> rows = readRows(source);

        if (rows.isEmpty()) {
            return new ParseResult(new Resource(Map.of(), List.of()), warnings);
        }

        List<String> languages = new ArrayList<>();
        int firstRow;
        boolean headed = KEY_COLUMN.equalsIgnoreCase(rows.get(0).get(0).trim());
        if (headed) {
            languages.addAll(headerLanguages(rows.get(0), options, warnings));
            firstRow = 1;
        } else {
            languages.add(resolveReadLanguage(options, null, warnings));
            firstRow = 0;
        }

        List<Entry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = firstRow; i < rows.size(); i++) {
            CSVRecord row = rows.get(i);
            String key = row.get(0).trim();
            if (key.isEmpty()) {
                anomaly(options, warnings, "Row " + row.getRecordNumber() + " has no key, skipped");
                continue;
            }
            if (!seen.add(key)) {
                anomaly(options, warnings, "Duplicate key '" + key + "' on row " + row.getRecordNumber() + ", keeping the first");
                continue;
            }
            if (row.size() > languages.size() + 1) {
                anomaly(options, warnings, "Row " + row.getRecordNumber() + " has " + (row.size() - 1)
                        + " values for " + languages.size() + " language column(s), extra cells ignored");
            }

            for (int column = 0; column < languages.size(); column++) {
                String language = languages.get(column);
                if (language == null) {
                    continue;
                }
                String value = column + 1 < row.size() ? row.get(column + 1) : "";
                if (value.isEmpty() && headed) {
                    continue;
                }
                EntryStatus status = value.isEmpty() ? EntryStatus.NEW : EntryStatus.TRANSLATED;
                entries.add(new Entry(key, language, Translation.singular(value), status, null, Map.of()));
            }
        }

        if (debug) {
            logger.fine("[" + getClass().getSimpleName() + "] Parsed " + entries.size() + " entries, languages "
                    + languages);
        }
        return new ParseResult(new Resource(Map.of(), entries), warnings);
    }

    /**
     * Language per column; null marks a column that is skipped.
     */
    @NotNull
    private List<String> headerLanguages(
            @NotNull CSVRecord header,
            @NotNull ReadOptions options,
            @NotNull List<String> warnings
    ) {
        List<String> languages = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 1; i < header.size(); i++) {
            String language = header.get(i).trim();
            if (language.isEmpty()) {
                anomaly(options, warnings, "Column " + (i + 1) + " has no language, skipped");
                languages.add(null);
            } else if (!seen.add(LanguageCodes.normalize(language))) {
                anomaly(options, warnings, "Language '" + language + "' appears twice in the header, keeping the first");
                languages.add(null);
            } else {
                languages.add(language);
            }
        }
        return languages;
    }

    @NotNull
    private List<CSVRecord> readRows(byte @NotNull [] source) {
        try (CSVParser parser = CSVParser.parse(decodeUtf8(source), dialect())) {
            return parser.getRecords();
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new ResourceParseException(tag(), "Malformed table: " + e.getMessage(), e);
        }
    }

    // ══════════════════════════════════════════════
    // SERIALIZE
    // ══════════════════════════════════════════════

    @Override
    @NotNull
    public SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options) {
        List<String> warnings = new ArrayList<>();
        List<String> languages = columns(resource, options.language());

        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, dialect())) {
            List<String> header = new ArrayList<>();
            header.add(KEY_COLUMN);
            header.addAll(languages);
            printer.printRecord(header);

            for (String key : resource.keys()) {
                List<String> row = new ArrayList<>();
                row.add(key);
                boolean any = false;
                for (String language : languages) {
                    Optional<Entry> entry = resource.find(key, language);
                    row.add(entry.map(e -> cell(e, options, warnings)).orElse(""));
                    any |= entry.isPresent();
                }
                if (any) {
                    printer.printRecord(row);
                }
            }
        } catch (IOException e) {
            throw new ResourceWriteException(tag(), "Failed to write table: " + e.getMessage(), e);
        }

        return new SerializeResult(out.toString().getBytes(StandardCharsets.UTF_8), warnings);
    }

    @NotNull
    private static List<String> columns(@NotNull Resource resource, @Nullable String language) {
        if (language == null) {
            return new ArrayList<>(resource.languages());
        }
        for (String candidate : resource.languages()) {
            if (LanguageCodes.matches(candidate, language)) {
                return List.of(candidate);
            }
        }
        return List.of(language);
    }

    @NotNull
    private String cell(@NotNull Entry entry, @NotNull WriteOptions options, @NotNull List<String> warnings) {
        String text = entry.value() instanceof Translation.Plural plural
                ? collapsePlural(entry, plural, options, warnings)
                : entry.value().primaryText();
        if (text.isEmpty()) {
            warn(warnings, "Empty value '" + entry.key() + "' [" + entry.language() + "] reads back as a missing cell");
        }
        return text;
    }
}
