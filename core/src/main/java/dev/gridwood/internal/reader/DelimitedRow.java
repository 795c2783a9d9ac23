/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.reader;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Locates and decodes the fields of a single row.
 * <p>
 * The row is given as a buffer holding its bytes without the terminating line feed. Fields are
 * found by scanning for the delimiter byte; only fields inside the requested column range are
 * decoded. Decoding is lossy UTF-8: malformed sequences become U+FFFD instead of failing. As the
 * delimiter is an ASCII byte it can never be part of a multi-byte sequence, so decoding field by
 * field gives the same text as decoding the whole row first.
 * </p>
 */
public final class DelimitedRow {

    private DelimitedRow() {
    }

    /**
     * Number of fields in the row: delimiter count plus one.
     */
    public static long countFields(ByteBuffer row, byte delimiter) {
        long count = 1;
        int limit = row.limit();
        for (int i = 0; i < limit; i++) {
            if (row.get(i) == delimiter) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the cells for columns {@code [colStart, colStart + colCount)} of the row.
     * <p>
     * The result always has {@code colCount} entries. Columns the row does not have, including
     * negative column positions, are returned as empty strings.
     * </p>
     */
    public static List<String> cells(ByteBuffer row, byte delimiter, long colStart, int colCount) {
        List<String> cells = new ArrayList<>(colCount);
        int limit = row.limit();

        // start of field `field`, or -1 once the row has no more fields
        long field = 0;
        int fieldStart = 0;

        for (int c = 0; c < colCount; c++) {
            long target = colStart + c;
            if (target < 0) {
                cells.add("");
                continue;
            }

            while (field < target && fieldStart >= 0) {
                int next = indexOf(row, delimiter, fieldStart, limit);
                fieldStart = next < 0 ? -1 : next + 1;
                field++;
            }
            if (fieldStart < 0) {
                cells.add("");
                continue;
            }

            int next = indexOf(row, delimiter, fieldStart, limit);
            int fieldEnd = next < 0 ? limit : next;
            cells.add(decode(row, fieldStart, fieldEnd));

            fieldStart = next < 0 ? -1 : next + 1;
            field++;
        }
        return Collections.unmodifiableList(cells);
    }

    private static int indexOf(ByteBuffer row, byte delimiter, int from, int limit) {
        for (int i = from; i < limit; i++) {
            if (row.get(i) == delimiter) {
                return i;
            }
        }
        return -1;
    }

    private static String decode(ByteBuffer row, int start, int end) {
        if (start == end) {
            return "";
        }
        byte[] bytes = new byte[end - start];
        row.get(start, bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
