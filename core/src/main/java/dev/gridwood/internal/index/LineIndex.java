/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.index;

import java.nio.ByteBuffer;
import java.util.Arrays;

import dev.gridwood.internal.mapping.ByteMapping;

/**
 * Start offsets of every row of a mapped file.
 * <p>
 * Entry {@code i} is the file offset of the first byte of row {@code i}. Entries are strictly
 * increasing and the first entry is always 0. A zero-length file has no rows and therefore no
 * entries. A line feed that is the last byte of the file terminates the last row rather than
 * starting a new, empty one.
 * </p>
 * <p>
 * Offsets are kept in fixed-size pages of primitive longs, so building the index never copies
 * previously recorded entries and the row count is not limited by the maximum array length.
 * The index is immutable once built.
 * </p>
 */
public final class LineIndex {

    static final int PAGE_SHIFT = 14;
    static final int PAGE_SIZE = 1 << PAGE_SHIFT;
    private static final int PAGE_MASK = PAGE_SIZE - 1;

    private static final byte LINE_FEED = '\n';

    private static final System.Logger LOG = System.getLogger(LineIndex.class.getName());

    private final long[][] pages;
    private final long size;
    private final long length;
    private final boolean trailingLineFeed;

    private LineIndex(long[][] pages, long size, long length, boolean trailingLineFeed) {
        this.pages = pages;
        this.size = size;
        this.length = length;
        this.trailingLineFeed = trailingLineFeed;
    }

    /**
     * Scans every byte of the mapping once and records where each row starts.
     */
    public static LineIndex build(ByteMapping mapping) {
        long length = mapping.length();

        LineIndexEvent event = new LineIndexEvent();
        event.begin();
        long startNanos = System.nanoTime();

        Builder builder = new Builder();
        if (length > 0) {
            builder.add(0);
        }

        for (int s = 0; s < mapping.segmentCount(); s++) {
            ByteBuffer segment = mapping.segment(s);
            long base = mapping.segmentOffset(s);
            int limit = segment.limit();
            for (int i = 0; i < limit; i++) {
                if (segment.get(i) == LINE_FEED) {
                    long next = base + i + 1;
                    if (next < length) {
                        builder.add(next);
                    }
                }
            }
        }

        boolean trailingLineFeed = length > 0 && mapping.get(length - 1) == LINE_FEED;
        LineIndex index = builder.build(length, trailingLineFeed);

        event.path = mapping.path().toString();
        event.bytes = length;
        event.rows = index.size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Indexed ''{0}'': {1} rows in {2} ms",
                mapping.path(), index.size(), (System.nanoTime() - startNanos) / 1_000_000);

        return index;
    }

    /**
     * Number of rows.
     */
    public long size() {
        return size;
    }

    /**
     * File offset of the first byte of the given row.
     *
     * @throws IndexOutOfBoundsException if the row does not exist
     */
    public long start(long row) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of bounds for " + size + " rows");
        }
        return pages[(int) (row >>> PAGE_SHIFT)][(int) (row & PAGE_MASK)];
    }

    /**
     * File offset just past the last content byte of the given row, excluding its line feed.
     * Equal to {@link #start(long)} for an empty line.
     *
     * @throws IndexOutOfBoundsException if the row does not exist
     */
    public long end(long row) {
        long start = start(row);
        if (row + 1 < size) {
            return start(row + 1) - 1;
        }
        long end = trailingLineFeed ? length - 1 : length;
        return Math.max(start, end);
    }

    /**
     * Accumulates offsets page by page.
     */
    private static final class Builder {

        private long[][] pages = new long[4][];
        private int pageCount;
        private long[] current;
        private int used;
        private long size;

        void add(long offset) {
            if (current == null || used == PAGE_SIZE) {
                if (pageCount == pages.length) {
                    pages = Arrays.copyOf(pages, pageCount * 2);
                }
                current = new long[PAGE_SIZE];
                pages[pageCount++] = current;
                used = 0;
            }
            current[used++] = offset;
            size++;
        }

        LineIndex build(long length, boolean trailingLineFeed) {
            long[][] trimmed = Arrays.copyOf(pages, pageCount);
            if (pageCount > 0 && used < PAGE_SIZE) {
                trimmed[pageCount - 1] = Arrays.copyOf(current, used);
            }
            return new LineIndex(trimmed, size, length, trailingLineFeed);
        }
    }
}
