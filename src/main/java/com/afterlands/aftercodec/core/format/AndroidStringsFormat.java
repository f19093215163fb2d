package com.afterlands.aftercodec.core.format;

import com.afterlands.aftercodec.api.error.ResourceParseException;
import com.afterlands.aftercodec.api.format.ParseResult;
import com.afterlands.aftercodec.api.format.ReadOptions;
import com.afterlands.aftercodec.api.format.SerializeResult;
import com.afterlands.aftercodec.api.format.WriteOptions;
import com.afterlands.aftercodec.api.model.Entry;
import com.afterlands.aftercodec.api.model.EntryStatus;
import com.afterlands.aftercodec.api.model.PluralCategory;
import com.afterlands.aftercodec.api.model.Resource;
import com.afterlands.aftercodec.api.model.Translation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Android {@code res/values/strings.xml} files.
 *
 * <h3>Syntax:</h3>
 * <pre>{@code
 * <resources>
 *     <!-- Title of the welcome screen -->
 *     <string name="welcome_title">Welcome!</string>
 *     <string name="app_name" translatable="false">AfterCodec</string>
 *     <plurals name="items">
 *         <item quantity="one">%d item</item>
 *         <item quantity="other">%d items</item>
 *     </plurals>
 * </resources>
 * }</pre>
 *
 * <ul>
 *     <li>a comment right before an element becomes the entry comment</li>
 *     <li>{@code translatable="false"}: DO_NOT_TRANSLATE; empty value: NEW; otherwise TRANSLATED</li>
 *     <li>the file does not name its language; it comes from the read options</li>
 *     <li>Android escapes ({@code \' \" \n \t \@ \?}) are decoded on read and applied on write;
 *     a carriage return is written as a {@code \\u} escape</li>
 * </ul>
 *
 * <h3>Anomalies (strict fails, permissive warns and skips):</h3>
 * <ul>
 *     <li>element without {@code name}</li>
 *     <li>plural item with an unknown {@code quantity}</li>
 *     <li>plurals block without {@code other} (permissive keeps the categories it has)</li>
 * </ul>
 */
public class AndroidStringsFormat extends AbstractResourceFormat {

    public static final String TAG = "android";

    public AndroidStringsFormat(@NotNull Logger logger, boolean debug) {
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
        return Set.of("xml");
    }

    @Override
    public boolean supportsPlurals() {
        return true;
    }

    @Override
    public boolean multiLanguage() {
        return false;
    }

    @Override
    @NotNull
    public ParseResult parse(byte @NotNull [] source, @NotNull ReadOptions options) {
        List<String> warnings = new ArrayList<>();
        Document document = readDocument(source);

        Element root = document.getDocumentElement();
        if (!"resources".equals(root.getTagName())) {
            throw new ResourceParseException(TAG, "Root element must be <resources>, found <" + root.getTagName() + ">");
        }

        String language = resolveReadLanguage(options, null, warnings);
        List<Entry> entries = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String pendingComment = null;

        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node instanceof Comment comment) {
                pendingComment = comment.getData().trim();
                continue;
            }
            if (!(node instanceof Element element)) {
                continue;
            }

            String comment = pendingComment;
            pendingComment = null;

            Entry entry = switch (element.getTagName()) {
                case "string" -> readString(element, language, comment, options, warnings);
                case "plurals" -> readPlurals(element, language, comment, options, warnings);
                default -> {
                    if (debug) {
                        logger.fine("[AndroidStringsFormat] Ignoring <" + element.getTagName() + ">");
                    }
                    yield null;
                }
            };

            if (entry == null) {
                continue;
            }
            if (!seen.add(entry.key())) {
                anomaly(options, warnings, "Duplicate name '" + entry.key() + "', keeping the first");
                continue;
            }
            entries.add(entry);
        }

        if (debug) {
            logger.fine("[AndroidStringsFormat] Parsed " + entries.size() + " entries [" + language + "]");
        }
        return new ParseResult(new Resource(Map.of(), entries), warnings);
    }

    @Nullable
    private Entry readString(
            @NotNull Element element,
            @NotNull String language,
            @Nullable String comment,
            @NotNull ReadOptions options,
            @NotNull List<String> warnings
    ) {
        String name = element.getAttribute("name");
        if (name.isEmpty()) {
            anomaly(options, warnings, "<string> without a name attribute skipped");
            return null;
        }

        String value = unescape(element.getTextContent());
        EntryStatus status;
        if ("false".equalsIgnoreCase(element.getAttribute("translatable"))) {
            status = EntryStatus.DO_NOT_TRANSLATE;
        } else if (value.isEmpty()) {
            status = EntryStatus.NEW;
        } else {
            status = EntryStatus.TRANSLATED;
        }
        return new Entry(name, language, Translation.singular(value), status, comment, Map.of());
    }

    @Nullable
    private Entry readPlurals(
            @NotNull Element element,
            @NotNull String language,
            @Nullable String comment,
            @NotNull ReadOptions options,
            @NotNull List<String> warnings
    ) {
        String name = element.getAttribute("name");
        if (name.isEmpty()) {
            anomaly(options, warnings, "<plurals> without a name attribute skipped");
            return null;
        }

        Map<PluralCategory, String> forms = new EnumMap<>(PluralCategory.class);
        NodeList items = element.getElementsByTagName("item");
        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            String quantity = item.getAttribute("quantity");
            PluralCategory category = PluralCategory.fromKey(quantity);
            if (category == null) {
                anomaly(options, warnings, "Plural '" + name + "' has unknown quantity '" + quantity + "', item skipped");
                continue;
            }
            forms.put(category, unescape(item.getTextContent()));
        }

        if (!forms.containsKey(PluralCategory.OTHER)) {
            anomaly(options, warnings, "Plural '" + name + "' has no 'other' item");
        }
        if (forms.isEmpty()) {
            warn(warnings, "Plural '" + name + "' has no usable items, skipped");
            return null;
        }

        EntryStatus status = "false".equalsIgnoreCase(element.getAttribute("translatable"))
                ? EntryStatus.DO_NOT_TRANSLATE
                : EntryStatus.TRANSLATED;
        return new Entry(name, language, Translation.plural(forms), status, comment, Map.of());
    }

    @Override
    @NotNull
    public SerializeResult serialize(@NotNull Resource resource, @NotNull WriteOptions options) {
        String language = resolveWriteLanguage(resource, options);

        StringBuilder out = new StringBuilder();
        out.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        out.append("<resources>\n");

        for (Entry entry : resource.entriesFor(language)) {
            if (entry.comment() != null && !entry.comment().isBlank()) {
                out.append("    <!-- ").append(xmlComment(entry.comment())).append(" -->\n");
            }

            String translatable = entry.status() == EntryStatus.DO_NOT_TRANSLATE ? " translatable=\"false\"" : "";
            if (entry.value() instanceof Translation.Plural plural) {
                out.append("    <plurals name=\"").append(xmlAttribute(entry.key())).append('"')
                        .append(translatable).append(">\n");
                for (Map.Entry<PluralCategory, String> form : plural.forms().entrySet()) {
                    out.append("        <item quantity=\"").append(form.getKey().getKey()).append("\">")
                            .append(escape(form.getValue())).append("</item>\n");
                }
                out.append("    </plurals>\n");
            } else {
                out.append("    <string name=\"").append(xmlAttribute(entry.key())).append('"')
                        .append(translatable).append('>')
                        .append(escape(entry.value().primaryText()))
                        .append("</string>\n");
            }
        }

        out.append("</resources>\n");
        return new SerializeResult(out.toString().getBytes(StandardCharsets.UTF_8), List.of());
    }

    @NotNull
    private static Document readDocument(byte @NotNull [] source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            factory.setIgnoringComments(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(source));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        } catch (SAXException e) {
            throw new ResourceParseException(TAG, "Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ResourceParseException(TAG, "Failed to read XML: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes Android string escapes and surrounding double quotes.
     */
    @NotNull
    static String unescape(@NotNull String raw) {
        String text = raw;
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"") && !text.endsWith("\\\"")) {
            text = text.substring(1, text.length() - 1);
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                sb.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    if (i + 4 < text.length()) {
                        try {
                            sb.append((char) Integer.parseInt(text.substring(i + 1, i + 5), 16));
                            i += 4;
                        } catch (NumberFormatException e) {
                            sb.append('\\').append(next);
                        }
                    } else {
                        sb.append('\\').append(next);
                    }
                }
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }

    /**
     * Encodes text for an Android string body.
     */
    @NotNull
    static String escape(@NotNull String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\u000D");
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '@', '?' -> {
                    if (i == 0) sb.append('\\');
                    sb.append(c);
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Comment body without {@code --} and without a trailing {@code -}.
     */
    @NotNull
    static String xmlComment(@NotNull String comment) {
        String text = comment;
        while (text.contains("--")) {
            text = text.replace("--", "- -");
        }
        return text.endsWith("-") ? text + " " : text;
    }

    @NotNull
    private static String xmlAttribute(@NotNull String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;");
    }
}
