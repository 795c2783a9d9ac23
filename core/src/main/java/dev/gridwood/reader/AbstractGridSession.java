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
import dev.gridwood.grid.RowData;

/**
 * Base class for GridSession implementations providing the window iteration shared by all sessions.
 * Subclasses must implement {@link #readCells(long, long, int)}.
 */
abstract class AbstractGridSession implements GridSession {

    protected final long totalRows;
    protected final long totalCols;

    protected AbstractGridSession(long totalRows, long totalCols) {
        this.totalRows = totalRows;
        this.totalCols = totalCols;
    }

    /**
     * Returns the cells of an existing row for the given column range.
     *
     * @param rowIndex a row index in {@code [0, totalRows)}
     */
    protected abstract List<String> readCells(long rowIndex, long colStart, int colCount);

    @Override
    public long totalRows() {
        return totalRows;
    }

    @Override
    public long totalCols() {
        return totalCols;
    }

    @Override
    public List<String> getHeaderChunk(long colStart, int colCount) {
        if (colCount <= 0 || colStart >= totalCols) {
            return List.of();
        }
        List<String> headers = new ArrayList<>((int) Math.min(colCount, totalCols));
        for (int i = 0; i < colCount; i++) {
            long index = colStart + i;
            if (index < 0) {
                continue;
            }
            if (index >= totalCols) {
                break;
            }
            headers.add(ColumnNamer.name(index));
        }
        return Collections.unmodifiableList(headers);
    }

    @Override
    public List<RowData> getGridChunk(long rowStart, int rowCount, long colStart, int colCount) {
        if (rowCount <= 0 || colCount <= 0 || rowStart >= totalRows) {
            return List.of();
        }
        // rowStart < totalRows, so rowStart + r cannot overflow
        List<RowData> rows = new ArrayList<>((int) Math.min(rowCount, totalRows - Math.max(rowStart, 0)));
        for (int r = 0; r < rowCount; r++) {
            long rowIndex = rowStart + r;
            if (rowIndex < 0) {
                continue;
            }
            if (rowIndex >= totalRows) {
                break;
            }
            rows.add(new RowData(rowIndex, readCells(rowIndex, colStart, colCount)));
        }
        return Collections.unmodifiableList(rows);
    }
}
