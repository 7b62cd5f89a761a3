package com.leyesmx.infrastructure.parsing.pattern;

import java.util.Map;

/**
 * Roman numeral helpers for fraction labels.
 */
public final class RomanNumerals {

    private static final Map<Character, Integer> VALUES = Map.of(
            'I', 1, 'V', 5, 'X', 10, 'L', 50, 'C', 100, 'D', 500, 'M', 1000
    );

    private RomanNumerals() {}

    /**
     * @return the value of an upper-case roman numeral, or -1 if it is empty or malformed
     */
    public static int toInt(String numeral) {
        if (numeral == null || numeral.isEmpty()) {
            return -1;
        }
        int total = 0;
        for (int i = 0; i < numeral.length(); i++) {
            Integer value = VALUES.get(numeral.charAt(i));
            if (value == null) {
                return -1;
            }
            Integer next = i + 1 < numeral.length() ? VALUES.get(numeral.charAt(i + 1)) : null;
            if (next != null && next > value) {
                total -= value;
            } else {
                total += value;
            }
        }
        return toRoman(total).equals(numeral) ? total : -1;
    }

    public static String toRoman(int value) {
        if (value <= 0 || value >= 4000) {
            return "";
        }
        int[] values = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
        String[] symbols = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        for (int i = 0; i < values.length; i++) {
            while (remaining >= values[i]) {
                sb.append(symbols[i]);
                remaining -= values[i];
            }
        }
        return sb.toString();
    }

    public static boolean isRoman(String numeral) {
        return toInt(numeral) > 0;
    }
}
