/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.gridwood.grid.ColumnNamer;

/**
 * Synthetic grid session of arbitrary size that needs no backing file.
 * <p>
 * Each cell holds its column name and row index, e.g. {@code "AB,1000"}. Unlike file-backed
 * sessions, rows here are bounded by {@link #totalCols()}: a window reaching past the last
 * column yields shorter rows rather than padding.
 * </p>
 */
final class DemoGridSession extends AbstractGridSession {

    DemoGridSession(long totalRows, long totalCols) {
        super(requireNonNegative(totalRows, "totalRows"), requireNonNegative(totalCols, "totalCols"));
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    @Override
    protected List<String> readCells(long rowIndex, long colStart, int colCount) {
        if (colStart >= totalCols) {
            return List.of();
        }
        List<String> cells = new ArrayList<>((int) Math.min(colCount, totalCols));
        for (int c = 0; c < colCount; c++) {
            long col = colStart + c;
            if (col < 0) {
                continue;
            }
            if (col >= totalCols) {
                break;
            }
            cells.add(ColumnNamer.name(col) + "," + rowIndex);
        }
        return Collections.unmodifiableList(cells);
    }

    @Override
    public String toString() {
        return "DemoGridSession[rows=" + totalRows + ", cols=" + totalCols + "]";
    }
}
