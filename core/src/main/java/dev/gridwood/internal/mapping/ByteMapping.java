/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.mapping;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import dev.gridwood.reader.GridFileException;

/**
 * Read-only, zero-copy view of the bytes of a file.
 * <p>
 * The file is mapped as consecutive segments of at most {@code segmentSize} bytes, since a single
 * {@link MappedByteBuffer} cannot exceed 2 GiB. The file channel is closed as soon as all segments
 * are mapped; the segments remain valid and are released by the garbage collector once the last
 * holder of this mapping becomes unreachable.
 * </p>
 * <p>
 * The view is never written to, and all reads use absolute positions, so a mapping can be shared
 * between any number of threads. The backing file must not be modified or truncated by anyone else
 * while the mapping is alive; doing so is not detected and leads to undefined results.
 * </p>
 */
public final class ByteMapping {

    public static final int DEFAULT_SEGMENT_SIZE = 1 << 30;

    public static final String SEGMENT_SIZE_PROPERTY = "gridwood.mapping.segmentsize";

    private static final System.Logger LOG = System.getLogger(ByteMapping.class.getName());

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0).asReadOnlyBuffer();

    private final Path path;
    private final MappedByteBuffer[] segments;
    private final int segmentSize;
    private final long length;

    private ByteMapping(Path path, MappedByteBuffer[] segments, int segmentSize, long length) {
        this.path = path;
        this.segments = segments;
        this.segmentSize = segmentSize;
        this.length = length;
    }

    /**
     * Maps the given file using the configured segment size.
     *
     * @throws GridFileException if the file cannot be opened or mapped
     */
    public static ByteMapping open(Path path) throws GridFileException {
        return open(path, configuredSegmentSize());
    }

    /**
     * Maps the given file using segments of at most {@code segmentSize} bytes.
     *
     * @throws GridFileException if the file cannot be opened or mapped
     * @throws IllegalArgumentException if the segment size is not positive
     */
    public static ByteMapping open(Path path, int segmentSize) throws GridFileException {
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("Segment size must be positive: " + segmentSize);
        }
        if (Files.isDirectory(path)) {
            throw new GridFileException(GridFileException.Kind.IO_ERROR, path, "Not a regular file: " + path, null);
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long length = channel.size();
            long requiredSegments = (length + segmentSize - 1) / segmentSize;
            if (requiredSegments > Integer.MAX_VALUE) {
                throw new GridFileException(GridFileException.Kind.IO_ERROR, path,
                        "Cannot map file " + path + ": " + length + " bytes exceed the segment limit for segment size " + segmentSize, null);
            }
            int segmentCount = (int) requiredSegments;
            MappedByteBuffer[] segments = new MappedByteBuffer[segmentCount];

            for (int i = 0; i < segmentCount; i++) {
                long offset = (long) i * segmentSize;
                long size = Math.min(segmentSize, length - offset);

                FileMappingEvent event = new FileMappingEvent();
                event.begin();

                segments[i] = channel.map(FileChannel.MapMode.READ_ONLY, offset, size);

                event.path = path.toString();
                event.offset = offset;
                event.size = size;
                event.segment = i;
                event.commit();
            }

            LOG.log(System.Logger.Level.DEBUG, "Mapped file ''{0}'': {1} bytes in {2} segments",
                    path, length, segmentCount);

            return new ByteMapping(path, segments, segmentSize, length);
        }
        catch (IOException e) {
            throw GridFileException.of(path, e);
        }
    }

    /**
     * Returns the segment size configured via {@value #SEGMENT_SIZE_PROPERTY},
     * or {@link #DEFAULT_SEGMENT_SIZE} if unset or invalid.
     */
    public static int configuredSegmentSize() {
        String property = System.getProperty(SEGMENT_SIZE_PROPERTY);
        if (property == null || property.isBlank()) {
            return DEFAULT_SEGMENT_SIZE;
        }
        try {
            int size = Integer.parseInt(property.trim());
            if (size > 0) {
                return size;
            }
        }
        catch (NumberFormatException e) {
            // fall through to the warning below
        }
        LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value ''{0}'' for {1}, using {2}",
                property, SEGMENT_SIZE_PROPERTY, DEFAULT_SEGMENT_SIZE);
        return DEFAULT_SEGMENT_SIZE;
    }

    public Path path() {
        return path;
    }

    /**
     * Total number of mapped bytes, i.e. the file size at the time of mapping.
     */
    public long length() {
        return length;
    }

    public int segmentCount() {
        return segments.length;
    }

    /**
     * File offset of the first byte of the given segment.
     */
    public long segmentOffset(int segment) {
        Objects.checkIndex(segment, segments.length);
        return (long) segment * segmentSize;
    }

    /**
     * Returns a read-only view of the given segment, positioned at zero.
     */
    public ByteBuffer segment(int segment) {
        Objects.checkIndex(segment, segments.length);
        return segments[segment].duplicate();
    }

    /**
     * Returns the byte at the given file position.
     *
     * @throws IndexOutOfBoundsException if the position is outside the mapping
     */
    public byte get(long position) {
        Objects.checkIndex(position, length);
        return segments[(int) (position / segmentSize)].get((int) (position % segmentSize));
    }

    /**
     * Returns the bytes in {@code [start, end)} as a read-only buffer positioned at zero.
     * <p>
     * A range within a single segment is a view onto the mapping. A range spanning a segment
     * boundary is copied.
     * </p>
     *
     * @throws IndexOutOfBoundsException if the range is outside the mapping
     * @throws IllegalArgumentException if the range is larger than a single buffer can hold
     */
    public ByteBuffer slice(long start, long end) {
        Objects.checkFromToIndex(start, end, length);
        if (start == end) {
            return EMPTY;
        }
        long size = end - start;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Range too large for a single buffer: " + size + " bytes");
        }

        int first = (int) (start / segmentSize);
        int last = (int) ((end - 1) / segmentSize);
        if (first == last) {
            return segments[first].slice((int) (start - (long) first * segmentSize), (int) size);
        }

        ByteBuffer copy = ByteBuffer.allocate((int) size);
        long position = start;
        for (int s = first; s <= last; s++) {
            long segmentStart = (long) s * segmentSize;
            int from = (int) (position - segmentStart);
            int to = (int) (Math.min(end, segmentStart + segments[s].limit()) - segmentStart);
            copy.put(segments[s].slice(from, to - from));
            position = segmentStart + to;
        }
        return copy.flip().asReadOnlyBuffer();
    }
}
