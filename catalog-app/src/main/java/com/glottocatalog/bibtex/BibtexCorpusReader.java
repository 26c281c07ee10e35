package com.glottocatalog.bibtex;

import com.glottocatalog.model.BibRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a BibTeX corpus into raw {@link BibRecord}s.
 *
 * <p>Entries start with '@' followed by the entry type and a brace or paren delimited body.
 * Braces inside quoted values and escaped quotes are handled; @comment and @preamble blocks
 * are skipped and @string definitions are substituted into bare values. Field values are
 * returned still escaped, see {@link BibtexText#unescape(String)}.
 */
public final class BibtexCorpusReader {

    private static final Logger log = LoggerFactory.getLogger(BibtexCorpusReader.class);

    private BibtexCorpusReader() {
    }

    public static List<BibRecord> read(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bibliography " + file, e);
        }
    }

    public static List<BibRecord> parse(String input) {
        List<BibRecord> records = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return records;
        }
        Map<String, String> macros = new HashMap<>();

        int n = input.length();
        int i = 0;
        while (i < n) {
            int at = input.indexOf('@', i);
            if (at < 0) break;

            int typeStart = at + 1;
            while (typeStart < n && Character.isWhitespace(input.charAt(typeStart))) typeStart++;
            int typeEnd = typeStart;
            while (typeEnd < n && (Character.isLetterOrDigit(input.charAt(typeEnd)) || input.charAt(typeEnd) == '_')) {
                typeEnd++;
            }
            if (typeEnd == typeStart) {
                i = at + 1;
                continue;
            }
            String type = input.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);

            int open = typeEnd;
            while (open < n && Character.isWhitespace(input.charAt(open))) open++;
            if (open >= n || (input.charAt(open) != '{' && input.charAt(open) != '(')) {
                i = typeEnd;
                continue;
            }

            int close = findClose(input, open);
            if (close < 0) {
                log.warn("Unclosed entry starting at index {} (@{})", at, type);
                break;
            }
            String body = input.substring(open + 1, close);
            i = close + 1;

            switch (type) {
                case "comment", "preamble" -> { }
                case "string" -> macros.putAll(parseFields(body, macros));
                default -> {
                    int comma = topLevelComma(body, 0);
                    if (comma < 0) {
                        log.warn("Entry without fields at index {} (@{})", at, type);
                        continue;
                    }
                    String key = body.substring(0, comma).strip();
                    records.add(new BibRecord(type, key, parseFields(body.substring(comma + 1), macros)));
                }
            }
        }
        return records;
    }

    private static int findClose(String input, int open) {
        char openChar = input.charAt(open);
        char closeChar = openChar == '{' ? '}' : ')';
        int depth = 0;
        for (int p = open; p < input.length(); p++) {
            char c = input.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == openChar) {
                depth++;
            } else if (c == closeChar) {
                depth--;
                if (depth == 0) {
                    return p;
                }
            }
        }
        return -1;
    }

    private static int topLevelComma(String body, int from) {
        int depth = 0;
        boolean inQuotes = false;
        for (int p = from; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '"' && depth == 0) {
                inQuotes = !inQuotes;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0 && !inQuotes) {
                return p;
            }
        }
        return -1;
    }

    /**
     * Parses "name = value, name = value" where a value is {braced}, "quoted", a bare word
     * or number, or a '#' concatenation of those.
     */
    static Map<String, String> parseFields(String body, Map<String, String> macros) {
        Map<String, String> fields = new LinkedHashMap<>();
        int n = body.length();
        int p = 0;
        while (p < n) {
            int eq = body.indexOf('=', p);
            if (eq < 0) break;
            String name = body.substring(p, eq).strip().toLowerCase(Locale.ROOT);
            // tolerate stray commas before the name
            int lastComma = name.lastIndexOf(',');
            if (lastComma >= 0) {
                name = name.substring(lastComma + 1).strip();
            }

            StringBuilder value = new StringBuilder();
            int q = eq + 1;
            while (true) {
                while (q < n && Character.isWhitespace(body.charAt(q))) q++;
                if (q >= n) break;
                char c = body.charAt(q);
                if (c == '{') {
                    int end = matchingBrace(body, q);
                    value.append(body, q + 1, end);
                    q = Math.min(end + 1, n);
                } else if (c == '"') {
                    int end = closingQuote(body, q);
                    value.append(body, q + 1, end);
                    q = Math.min(end + 1, n);
                } else {
                    int end = q;
                    while (end < n && body.charAt(end) != ',' && body.charAt(end) != '#') end++;
                    String bare = body.substring(q, end).strip();
                    value.append(macros.getOrDefault(bare.toLowerCase(Locale.ROOT), bare));
                    q = end;
                }
                while (q < n && Character.isWhitespace(body.charAt(q))) q++;
                if (q < n && body.charAt(q) == '#') {
                    q++;
                    continue;
                }
                break;
            }
            if (!name.isEmpty()) {
                String normalized = value.toString().replaceAll("\\s+", " ").strip();
                if (fields.putIfAbsent(name, normalized) != null) {
                    log.debug("Duplicate field '{}' ignored", name);
                }
            }
            while (q < n && body.charAt(q) != ',') q++;
            p = q + 1;
        }
        return fields;
    }

    private static int matchingBrace(String body, int open) {
        int depth = 0;
        for (int p = open; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return p;
                }
            }
        }
        return body.length();
    }

    private static int closingQuote(String body, int open) {
        int depth = 0;
        for (int p = open + 1; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '"' && depth == 0) {
                return p;
            }
        }
        return body.length();
    }
}
