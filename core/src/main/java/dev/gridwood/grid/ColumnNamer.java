/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.grid;

/**
 * Maps zero-based column indexes to spreadsheet-style column names.
 *
 * <p>Names form a bijective base-26 numeral system: {@code 0 -> "A"}, {@code 25 -> "Z"},
 * {@code 26 -> "AA"}, {@code 701 -> "ZZ"}, {@code 702 -> "AAA"}. There is no digit for zero
 * past the first position, so every non-negative index has exactly one name.</p>
 */
public final class ColumnNamer {

    private static final int RADIX = 26;

    // Long.MAX_VALUE is "CRPXNLSKVLJFHH"
    private static final int MAX_NAME_LENGTH = 14;

    private ColumnNamer() {
    }

    /**
     * Returns the alphabetic name of the given column.
     *
     * @param index zero-based column index
     * @return the column name, e.g. {@code "AB"} for index 27
     * @throws IllegalArgumentException if the index is negative
     */
    public static String name(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + index);
        }
        char[] letters = new char[MAX_NAME_LENGTH];
        int pos = letters.length;
        long n = index;
        do {
            letters[--pos] = (char) ('A' + (int) (n % RADIX));
            n = n / RADIX - 1;
        } while (n >= 0);
        return new String(letters, pos, letters.length - pos);
    }
}
