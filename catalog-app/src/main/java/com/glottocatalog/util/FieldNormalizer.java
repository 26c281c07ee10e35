package com.glottocatalog.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw bibliographic text into typed values. Malformed input never throws,
 * it yields an absent (null) value.
 */
public final class FieldNormalizer {

    // [1987] or [1987-2], the trailing part marks an edition and is dropped
    private static final Pattern PREFERRED_YEAR_PATTERN = Pattern.compile("\\[(?<year>[12][0-9]{3})(-[0-9]+)?]");
    private static final Pattern YEAR_PATTERN = Pattern.compile("(?<year>[12][0-9]{3})");

    private static final String ROMAN = "(?<roman>[ivxlcdmIVXLCDM]+)";
    private static final String ARABIC = "(?<arabic>[0-9]+)";
    private static final Pattern ROMAN_PLUS_ARABIC = Pattern.compile(ROMAN + "\\+" + ARABIC);
    private static final Pattern ARABIC_PLUS_ROMAN = Pattern.compile(ARABIC + "\\+" + ROMAN);

    private static final Pattern PAGE_RANGE = Pattern.compile("(?<start>[0-9]+)\\s*-{1,2}\\s*(?<end>[0-9]+)");
    private static final Pattern PREFATORY_AND_COUNT = Pattern.compile(
        "^\\s*" + ROMAN + "\\s*[,;]\\s*" + ARABIC + "\\s*(pp?\\.?)?\\s*$");
    private static final Pattern PAGE_COUNT = Pattern.compile("^\\s*(?<count>[0-9]+)\\s*(pp?\\.?|pages)?\\s*$");

    private FieldNormalizer() {
    }

    // ========== YEARS ==========

    /**
     * Prefers a bracketed year over the first four digit number starting with 1 or 2.
     */
    public static Integer extractYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher m = PREFERRED_YEAR_PATTERN.matcher(raw);
        if (m.find()) {
            return Integer.parseInt(m.group("year"));
        }
        m = YEAR_PATTERN.matcher(raw);
        return m.find() ? Integer.parseInt(m.group("year")) : null;
    }

    // ========== PUBLISHER / ADDRESS ==========

    /**
     * Splits "Berlin: Mouton" into address and publisher.
     *
     * @param publisher       raw publisher text
     * @param existingAddress the address already known for the record, may be null
     * @return the address to use, which is the existing one unless it is absent or equal to
     *         the computed one, and the publisher
     */
    public static PublisherAddress splitPublisherAddress(String publisher, String existingAddress) {
        if (publisher == null || publisher.indexOf(':') < 0) {
            return new PublisherAddress(existingAddress, publisher);
        }
        int colon = publisher.indexOf(':');
        String address = publisher.substring(0, colon).strip();
        String name = publisher.substring(colon + 1).strip();
        if (existingAddress == null || existingAddress.equals(address)) {
            return new PublisherAddress(address, name);
        }
        return new PublisherAddress(existingAddress, name);
    }

    // ========== PAGES ==========

    /**
     * Derives start page, end page and number of pages.
     *
     * @param pages         raw page description, e.g. "xii+234", "12-34", "xii, 34"
     * @param numberOfPages raw explicit page count; when numeric it always wins as total
     */
    public static PageCounts parsePages(String pages, String numberOfPages) {
        PageCounts result = PageCounts.NONE;
        if (pages != null && !pages.isBlank()) {
            Matcher m = ROMAN_PLUS_ARABIC.matcher(pages);
            if (!m.find()) {
                m = ARABIC_PLUS_ROMAN.matcher(pages);
                if (!m.find()) {
                    m = null;
                }
            }
            if (m != null) {
                result = new PageCounts(null, null, romanPlusArabic(m.group("roman"), parseInteger(m.group("arabic"))));
            } else {
                result = computePageRange(pages);
            }
        }
        Integer explicit = parseInteger(numberOfPages);
        return explicit != null ? result.withTotal(explicit) : result;
    }

    /**
     * Page range computation for free text: Arabic ranges, prefatory Roman plus Arabic
     * count, or a bare page count.
     */
    public static PageCounts computePageRange(String pages) {
        if (pages == null || pages.isBlank()) {
            return PageCounts.NONE;
        }
        Integer start = null;
        Integer end = null;
        Integer total = 0;
        Matcher m = PAGE_RANGE.matcher(pages);
        while (m.find()) {
            Integer from = parseInteger(m.group("start"));
            Integer to = parseInteger(m.group("end"));
            if (from == null || to == null) {
                continue;
            }
            to = expandAbbreviatedEnd(m.group("start"), m.group("end"), from, to);
            if (to < from) {
                continue;
            }
            if (start == null) {
                start = from;
            }
            end = to;
            total = add(total, to - from, 1);
        }
        if (start != null) {
            return new PageCounts(start, end, total);
        }

        m = PREFATORY_AND_COUNT.matcher(pages);
        if (m.matches()) {
            Integer counted = romanPlusArabic(m.group("roman"), parseInteger(m.group("arabic")));
            return counted == null ? PageCounts.NONE : new PageCounts(null, null, counted);
        }

        m = PAGE_COUNT.matcher(pages);
        if (m.matches()) {
            return new PageCounts(null, null, parseInteger(m.group("count")));
        }
        return PageCounts.NONE;
    }

    // "123-45" means 123 to 145
    private static int expandAbbreviatedEnd(String startText, String endText, int start, int end) {
        if (end >= start || endText.length() >= startText.length()) {
            return end;
        }
        Integer expanded = parseInteger(startText.substring(0, startText.length() - endText.length()) + endText);
        return expanded != null ? expanded : end;
    }

    private static Integer romanPlusArabic(String roman, Integer arabic) {
        return arabic == null ? null : add(RomanNumerals.toInt(roman), arabic);
    }

    // null when any operand is null or the sum overflows
    private static Integer add(Integer a, int... more) {
        if (a == null) {
            return null;
        }
        try {
            int sum = a;
            for (int b : more) {
                sum = Math.addExact(sum, b);
            }
            return sum;
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Lenient integer parsing, null for anything that is not a plain integer.
     */
    public static Integer parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.valueOf(raw.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
