package com.glottocatalog.util;

import java.util.Locale;

/**
 * Conversion of Roman numerals (I, V, X, L, C, D, M) using subtractive notation.
 */
public final class RomanNumerals {

    private RomanNumerals() {
    }

    public static boolean isRoman(String text) {
        return text != null && !text.isEmpty() && text.toLowerCase(Locale.ROOT).matches("[ivxlcdm]+");
    }

    /**
     * @throws IllegalArgumentException if the text contains anything but Roman digits
     */
    public static int toInt(String text) {
        if (!isRoman(text)) {
            throw new IllegalArgumentException("Not a Roman numeral: " + text);
        }
        String s = text.toLowerCase(Locale.ROOT);
        int total = 0;
        for (int i = 0; i < s.length(); i++) {
            int value = valueOf(s.charAt(i));
            if (i + 1 < s.length() && value < valueOf(s.charAt(i + 1))) {
                total -= value;
            } else {
                total += value;
            }
        }
        return total;
    }

    private static int valueOf(char c) {
        return switch (c) {
            case 'i' -> 1;
            case 'v' -> 5;
            case 'x' -> 10;
            case 'l' -> 50;
            case 'c' -> 100;
            case 'd' -> 500;
            case 'm' -> 1000;
            default -> throw new IllegalArgumentException("Not a Roman digit: " + c);
        };
    }
}
