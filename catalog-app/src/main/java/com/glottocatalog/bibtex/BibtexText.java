package com.glottocatalog.bibtex;

import java.text.Normalizer;
import java.util.Map;

/**
 * Decoding of the LaTeX escapes found in BibTeX field values: accents such as {\"a} or
 * \v{c}, special letters such as {\ss}, escaped specials such as \&, and grouping braces.
 * Unknown commands are kept verbatim.
 */
public final class BibtexText {

    private static final Map<Character, Character> ACCENTS = Map.ofEntries(
        Map.entry('\'', '\u0301'),
        Map.entry('`', '\u0300'),
        Map.entry('^', '\u0302'),
        Map.entry('"', '\u0308'),
        Map.entry('~', '\u0303'),
        Map.entry('=', '\u0304'),
        Map.entry('.', '\u0307'),
        Map.entry('u', '\u0306'),
        Map.entry('v', '\u030c'),
        Map.entry('H', '\u030b'),
        Map.entry('c', '\u0327'),
        Map.entry('k', '\u0328'),
        Map.entry('r', '\u030a'),
        Map.entry('d', '\u0323'),
        Map.entry('b', '\u0331')
    );

    private static final Map<String, String> LETTERS = Map.ofEntries(
        Map.entry("ss", "\u00df"),
        Map.entry("o", "\u00f8"),
        Map.entry("O", "\u00d8"),
        Map.entry("ae", "\u00e6"),
        Map.entry("AE", "\u00c6"),
        Map.entry("oe", "\u0153"),
        Map.entry("OE", "\u0152"),
        Map.entry("aa", "\u00e5"),
        Map.entry("AA", "\u00c5"),
        Map.entry("l", "\u0142"),
        Map.entry("L", "\u0141"),
        Map.entry("i", "\u0131"),
        Map.entry("j", "\u0237"),
        Map.entry("ng", "\u014b"),
        Map.entry("NG", "\u014a"),
        Map.entry("th", "\u00fe"),
        Map.entry("TH", "\u00de"),
        Map.entry("dh", "\u00f0"),
        Map.entry("DH", "\u00d0")
    );

    private static final String SPECIALS = "&%$#_{}";

    private BibtexText() {
    }

    public static String unescape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        int n = value.length();
        int i = 0;
        while (i < n) {
            char c = value.charAt(i);
            if (c == '{' || c == '}') {
                i++;
            } else if (c == '~') {
                out.append(' ');
                i++;
            } else if (c == '\\' && i + 1 < n) {
                i = command(value, i + 1, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return Normalizer.normalize(out.toString().replaceAll("\\s+", " ").strip(), Normalizer.Form.NFC);
    }

    /**
     * Decodes the command starting at {@code start} (just after the backslash).
     *
     * @return the index of the first character after the command and its argument
     */
    private static int command(String value, int start, StringBuilder out) {
        int n = value.length();
        char c = value.charAt(start);

        if (SPECIALS.indexOf(c) >= 0) {
            out.append(c);
            return start + 1;
        }
        if (c == '\\') {
            out.append(' ');
            return start + 1;
        }
        if (!Character.isLetter(c)) {
            if (ACCENTS.containsKey(c)) {
                return accent(value, start + 1, ACCENTS.get(c), out);
            }
            out.append('\\').append(c);
            return start + 1;
        }

        int end = start;
        while (end < n && Character.isLetter(value.charAt(end))) end++;
        String name = value.substring(start, end);

        if (name.length() == 1 && ACCENTS.containsKey(name.charAt(0))) {
            int arg = end;
            while (arg < n && value.charAt(arg) == ' ') arg++;
            return accent(value, arg, ACCENTS.get(name.charAt(0)), out);
        }
        if (LETTERS.containsKey(name)) {
            out.append(LETTERS.get(name));
            // a single space terminates a control word and is swallowed
            return end < n && value.charAt(end) == ' ' ? end + 1 : end;
        }
        out.append('\\').append(name);
        return end;
    }

    private static int accent(String value, int pos, char mark, StringBuilder out) {
        int n = value.length();
        if (pos >= n) {
            out.append(mark);
            return pos;
        }
        String base;
        int next;
        if (value.charAt(pos) == '{') {
            int close = value.indexOf('}', pos + 1);
            if (close < 0) {
                close = n;
            }
            base = value.substring(pos + 1, close);
            next = Math.min(close + 1, n);
        } else if (value.charAt(pos) == '\\' && pos + 1 < n) {
            int end = pos + 1;
            while (end < n && Character.isLetter(value.charAt(end))) end++;
            base = value.substring(pos, end);
            next = end;
        } else {
            base = String.valueOf(value.charAt(pos));
            next = pos + 1;
        }
        // dotless i and j carry the accent in LaTeX, the composed form uses the dotted letter
        if (base.equals("\\i")) {
            base = "i";
        } else if (base.equals("\\j")) {
            base = "j";
        }
        out.append(base).append(mark);
        return next;
    }
}
