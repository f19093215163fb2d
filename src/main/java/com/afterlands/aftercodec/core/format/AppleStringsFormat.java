package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Apple {@code .strings} files.
 *
 * <h3>Syntax:</h3>
 * <pre>
 * //: Language: en
 * //: Domain: Localizable
 *
 * /* Title of the welcome screen *&#47;
 * "welcome_title" = "Welcome!";
 *
 * // Shown when the cart is empty
 * "cart_empty" = "Your cart is \"empty\"";
 * </pre>
 *
 * <ul>
 *     <li>{@code //: Name: Value} header lines go to metadata; {@code Language} sets the language</li>
 *     <li>a {@code /* *&#47;} or {@code //} comment attaches to the next pair unless a blank line follows it</li>
 *     <li>escapes: {@code \" \\ \n \t \r}, plus {@code \Uxxxx}</li>
 *     <li>empty value: NEW, otherwise TRANSLATED</li>
 *     <li>UTF-8, or UTF-16 with a byte order mark</li>
 * </ul>
 *
 * <p>The format has no plural support.</p>
 */
public class AppleStringsFormat extends AbstractResourceFormat {

    public static final String TAG = "strings";

    private static final String LANGUAGE_HEADER = "Language";

    public AppleStringsFormat(@NotNull Logger logger, boolean debug) {
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
        return Set.of("strings");
    }

    @Override
    public boolean supportsPlurals() {
        return false;
    }

    @Override
    public boolean multiLanguage() {
        return false;
    }

    @Override
    @NotNull
    public ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options) {
        List<String> warnings = new ArrayList<>();
        Map<String, String> metadata = new LinkedHashMap<>();
        List<Pair> pairs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        Cursor cursor = new Cursor(decode(source));
        String pendingComment = null;

        while (true) {
            if (cursor.skipWhitespace() >= 2) {
                pendingComment = null;
            }
            if (cursor.atEnd()) {
                break;
            }

            if (cursor.startsWith("//:")) {
                String line = cursor.readLine().substring(3).trim();
                int colon = line.indexOf(':');
                if (colon > 0) {
                    metadata.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                }
                continue;
            }
            if (cursor.startsWith("//")) {
                pendingComment = cursor.readLine().substring(2).trim();
                continue;
            }
            if (cursor.startsWith("/*")) {
                int line = cursor.line;
                String body = cursor.readBlockComment();
                if (body == null) {
                    throw new ResourceParseException(TAG, "Unterminated comment starting at line " + line);
                }
                pendingComment = body.trim();
                continue;
            }

            int line = cursor.line;
            try {
                String key = cursor.readToken();
                cursor.skipWhitespace();
                cursor.expect('=');
                cursor.skipWhitespace();
                String value = cursor.readToken();
                cursor.skipWhitespace();
                cursor.expect(';');

                if (!seen.add(key)) {
                    anomaly(options, warnings, "Duplicate key '" + key + "' at line " + line + ", keeping the first");
                } else {
                    pairs.add(new Pair(key, value, pendingComment));
                }
                pendingComment = null;
            } catch (SyntaxException e) {
                if (options.strict()) {
                    throw new ResourceParseException(TAG, "Line " + line + ": " + e.getMessage(), e);
                }
                warn(warnings, "Skipped malformed line " + line + ": " + e.getMessage());
                cursor.skipPast(';');
                pendingComment = null;
            }
        }

        String language = resolveReadLanguage(options, metadata.remove(LANGUAGE_HEADER), warnings);

        List<Entry> entries = new ArrayList<>(pairs.size());
        for (Pair pair : pairs) {
            EntryStatus status = pair.value.isEmpty() ? EntryStatus.NEW : EntryStatus.TRANSLATED;
            entries.add(new Entry(pair.key, language, Translation.singular(pair.value), status, pair.comment, Map.of()));
        }

        if (debug) {
            logger.fine("[AppleStringsFormat] Parsed " + entries.size() + " pairs [" + language + "]");
        }
        return new ParseResult(new Resource(metadata, entries), warnings);
    }

    @Override
    @NotNull
    public SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options) {
        List<String> warnings = new ArrayList<>();
        String language = resolveWriteLanguage(resource, options);

        StringBuilder out = new StringBuilder();
        out.append("//: ").append(LANGUAGE_HEADER).append(": ").append(language).append('\n');
        for (Map.Entry<String, String> meta : resource.metadata().entrySet()) {
            if (meta.getKey().equals(LANGUAGE_HEADER)) {
                continue;
            }
            out.append("//: ").append(meta.getKey()).append(": ").append(singleLine(meta.getValue())).append('\n');
        }

        for (Entry entry : resource.entriesFor(language)) {
            String text = entry.value() instanceof Translation.Plural plural
                    ? collapsePlural(entry, plural, options, warnings)
                    : entry.value().primaryText();

            out.append('\n');
            if (entry.comment() != null && !entry.comment().isBlank()) {
                out.append("/* ").append(entry.comment().replace("*/", "* /")).append(" */\n");
            }
            out.append('"').append(escape(entry.key())).append("\" = \"").append(escape(text)).append("\";\n");
        }

        return new SerializeResult(out.toString().getBytes(StandardCharsets.UTF_8), warnings);
    }

    @NotNull
    static String escape(@NotNull String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String singleLine(String value) {
        return value.replace('\n', ' ').replace('\r', ' ');
    }

    @NotNull
    private static String decode(byte @NotNull [] source) {
        if (source.length >= 2) {
            int b0 = source[0] & 0xFF;
            int b1 = source[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) {
                return new String(source, 2, source.length - 2, StandardCharsets.UTF_16BE);
            }
            if (b0 == 0xFF && b1 == 0xFE) {
                return new String(source, 2, source.length - 2, StandardCharsets.UTF_16LE);
            }
        }
        return decodeUtf8(source);
    }

    private record Pair(String key, String value, @Nullable String comment) {
    }

    private static final class SyntaxException extends Exception {
        SyntaxException(String message) {
            super(message);
        }
    }

    /**
     * Character cursor tracking line numbers.
     */
    private static final class Cursor {
        private final String text;
        private int pos;
        private int line = 1;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        boolean startsWith(String prefix) {
            return text.startsWith(prefix, pos);
        }

        /**
         * Skips whitespace and returns how many line breaks were crossed.
         */
        int skipWhitespace() {
            int newlines = 0;
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                if (text.charAt(pos) == '\n') {
                    newlines++;
                    line++;
                }
                pos++;
            }
            return newlines;
        }

        String readLine() {
            int end = text.indexOf('\n', pos);
            if (end < 0) end = text.length();
            String result = text.substring(pos, end);
            pos = end;
            return result.endsWith("\r") ? result.substring(0, result.length() - 1) : result;
        }

        @Nullable
        String readBlockComment() {
            int end = text.indexOf("*/", pos + 2);
            if (end < 0) {
                return null;
            }
            String body = text.substring(pos + 2, end);
            line += body.chars().filter(c -> c == '\n').count();
            pos = end + 2;
            return body;
        }

        void expect(char c) throws SyntaxException {
            if (atEnd() || text.charAt(pos) != c) {
                throw new SyntaxException("expected '" + c + "'" + (atEnd() ? " but reached end of file" : " but found '" + text.charAt(pos) + "'"));
            }
            pos++;
        }

        void skipPast(char c) {
            while (pos < text.length()) {
                char current = text.charAt(pos++);
                if (current == '\n') line++;
                if (current == c) return;
            }
        }

        /**
         * Quoted string with escapes, or a bare identifier.
         */
        String readToken() throws SyntaxException {
            if (atEnd()) {
                throw new SyntaxException("unexpected end of file");
            }
            if (text.charAt(pos) == '"') {
                return readQuoted();
            }
            int start = pos;
            while (pos < text.length() && isBareChar(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw new SyntaxException("expected a quoted string but found '" + text.charAt(pos) + "'");
            }
            return text.substring(start, pos);
        }

        private static boolean isBareChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '$' || c == ':' || c == '/';
        }

        private String readQuoted() throws SyntaxException {
            pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c == '\n') {
                    line++;
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case 'U', 'u' -> sb.append(readUnicode());
                    default -> sb.append(escaped);
                }
            }
            throw new SyntaxException("unterminated string");
        }

        private char readUnicode() throws SyntaxException {
            if (pos + 4 > text.length()) {
                throw new SyntaxException("truncated unicode escape");
            }
            String hex = text.substring(pos, pos + 4);
            try {
                char c = (char) Integer.parseInt(hex, 16);
                pos += 4;
                return c;
            } catch (NumberFormatException e) {
                throw new SyntaxException("invalid unicode escape \\U" + hex);
            }
        }
    }
}
