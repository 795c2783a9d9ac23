/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import dev.gridwood.grid.RowData;

/**
 * Windowed, read-only access to a grid of cells.
 *
 * <p>A session answers rectangular "window" queries: a contiguous range of rows by a contiguous
 * range of columns. Queries never change the session, never fail, and may be issued concurrently
 * from any number of threads.</p>
 *
 * <pre>{@code
 * GridSession session = GridSession.open(path);
 * List<String> headers = session.getHeaderChunk(0, 6);
 * List<RowData> rows = session.getGridChunk(1_000, 60, 0, 6);
 * }</pre>
 *
 * <p>Opening scans the whole file once, so for large files prefer
 * {@link Gridwood#openAsync(Path)} to keep the calling thread responsive.</p>
 */
public interface GridSession {

    /**
     * Opens a comma-separated file.
     *
     * @throws GridFileException if the file cannot be opened or mapped
     */
    static GridSession open(Path path) throws IOException {
        return open(path, GridFormat.csv());
    }

    /**
     * Opens a delimited file with the given format.
     *
     * @throws GridFileException if the file cannot be opened or mapped
     */
    static GridSession open(Path path, GridFormat format) throws IOException {
        return MappedGridSession.open(path, format);
    }

    /**
     * Creates a synthetic session of the given size whose cells name their own position,
     * e.g. {@code "C,42"} for column 2 of row 42. No file is involved.
     *
     * @throws IllegalArgumentException if either size is negative
     */
    static GridSession demo(long totalRows, long totalCols) {
        return new DemoGridSession(totalRows, totalCols);
    }

    /**
     * Number of rows, fixed when the session is created.
     */
    long totalRows();

    /**
     * Estimated number of columns, fixed when the session is created.
     * For files this is the field count of the first row.
     */
    long totalCols();

    /**
     * Returns the names of columns {@code [colStart, colStart + colCount)}.
     * <p>
     * The result stops at {@link #totalCols()}; it is shorter than {@code colCount}
     * when the range extends past the last column, and never padded.
     * </p>
     */
    List<String> getHeaderChunk(long colStart, int colCount);

    /**
     * Returns rows {@code [rowStart, rowStart + rowCount)}, each restricted to columns
     * {@code [colStart, colStart + colCount)}.
     * <p>
     * The result stops at {@link #totalRows()}. A non-positive row or column count yields
     * an empty result.
     * </p>
     */
    List<RowData> getGridChunk(long rowStart, int rowCount, long colStart, int colCount);
}
