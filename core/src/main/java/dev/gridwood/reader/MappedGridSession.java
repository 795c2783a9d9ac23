/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.List;

import dev.gridwood.internal.index.LineIndex;
import dev.gridwood.internal.mapping.ByteMapping;
import dev.gridwood.internal.reader.DelimitedRow;

/**
 * Grid session backed by a memory-mapped delimited file.
 *
 * <p>Opening maps the file and builds a {@link LineIndex} in a single pass; afterwards each
 * query costs time proportional to the window, not to the file. The column count is estimated
 * from the first row only. Rows with more fields than that estimate still return their real
 * data for columns beyond it, and rows with fewer fields are padded with empty strings; only
 * the header names are bounded by the estimate.</p>
 *
 * <p>The session holds the only long-lived reference to the mapping. There is nothing to close:
 * the mapping is released once the session is no longer reachable.</p>
 */
public final class MappedGridSession extends AbstractGridSession {

    private static final System.Logger LOG = System.getLogger(MappedGridSession.class.getName());

    private final ByteMapping mapping;
    private final LineIndex lineIndex;
    private final GridFormat format;

    private MappedGridSession(ByteMapping mapping, LineIndex lineIndex, GridFormat format, long totalCols) {
        super(lineIndex.size(), totalCols);
        this.mapping = mapping;
        this.lineIndex = lineIndex;
        this.format = format;
    }

    static MappedGridSession open(Path path, GridFormat format) throws GridFileException {
        return open(path, format, ByteMapping.configuredSegmentSize());
    }

    static MappedGridSession open(Path path, GridFormat format, int segmentSize) throws GridFileException {
        ByteMapping mapping = ByteMapping.open(path, segmentSize);
        LineIndex lineIndex = LineIndex.build(mapping);

        long totalCols = 0;
        if (lineIndex.size() > 0) {
            ByteBuffer firstRow = mapping.slice(lineIndex.start(0), lineIndex.end(0));
            totalCols = DelimitedRow.countFields(firstRow, format.delimiter());
        }

        LOG.log(System.Logger.Level.DEBUG, "Opened session for ''{0}'' with {1} rows, {2} columns",
                path, lineIndex.size(), totalCols);

        return new MappedGridSession(mapping, lineIndex, format, totalCols);
    }

    public Path path() {
        return mapping.path();
    }

    public GridFormat format() {
        return format;
    }

    @Override
    protected List<String> readCells(long rowIndex, long colStart, int colCount) {
        long start = lineIndex.start(rowIndex);
        long end = lineIndex.end(rowIndex);
        if (start >= end) {
            return List.of();
        }
        return DelimitedRow.cells(mapping.slice(start, end), format.delimiter(), colStart, colCount);
    }

    @Override
    public String toString() {
        return "MappedGridSession[path=" + mapping.path() + ", rows=" + totalRows + ", cols=" + totalCols + "]";
    }
}
