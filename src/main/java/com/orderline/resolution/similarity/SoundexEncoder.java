package com.orderline.resolution.similarity;

import java.util.Locale;

/**
 * American Soundex: first letter plus three digits for the following consonant groups.
 * "broccoli" and "brocoli" both encode to B624.
 */
public final class SoundexEncoder {

    //                                       ABCDEFGHIJKLMNOPQRSTUVWXYZ
    private static final String DIGITS = "01230120022455012623010202";

    private SoundexEncoder() {
    }

    /**
     * Encodes the leading run of letters of {@code word}; returns "" when it has none.
     */
    public static String encode(String word) {
        if (word == null) {
            return "";
        }
        String upper = word.toUpperCase(Locale.ROOT);
        StringBuilder code = new StringBuilder(4);
        char lastDigit = 0;
        for (int i = 0; i < upper.length() && code.length() < 4; i++) {
            char c = upper.charAt(i);
            if (c < 'A' || c > 'Z') {
                if (code.length() == 0) {
                    continue;
                }
                break;
            }
            char digit = DIGITS.charAt(c - 'A');
            if (code.length() == 0) {
                code.append(c);
                lastDigit = digit;
                continue;
            }
            if (c == 'H' || c == 'W') {
                // H and W do not separate letters with the same code
                continue;
            }
            if (digit == '0') {
                lastDigit = 0;
                continue;
            }
            if (digit != lastDigit) {
                code.append(digit);
            }
            lastDigit = digit;
        }
        if (code.length() == 0) {
            return "";
        }
        while (code.length() < 4) {
            code.append('0');
        }
        return code.toString();
    }

    public static boolean soundsAlike(String w1, String w2) {
        String c1 = encode(w1);
        return !c1.isEmpty() && c1.equals(encode(w2));
    }
}
