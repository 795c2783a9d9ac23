/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.mapping;

import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.gridwood.reader.GridFileException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ByteMappingTest {

    @TempDir
    Path tempDir;

    @Test
    void mapsWholeFile() throws Exception {
        Path file = write("hello,world\n");

        ByteMapping mapping = ByteMapping.open(file);

        assertThat(mapping.length()).isEqualTo(12);
        assertThat(mapping.segmentCount()).isEqualTo(1);
        assertThat(mapping.path()).isEqualTo(file);
        assertThat(text(mapping.slice(0, 5))).isEqualTo("hello");
        assertThat(text(mapping.slice(6, 11))).isEqualTo("world");
        assertThat(mapping.get(11)).isEqualTo((byte) '\n');
    }

    @Test
    void sliceIsReadOnlyAndIndependentOfOtherSlices() throws Exception {
        ByteMapping mapping = ByteMapping.open(write("abcdef"));

        ByteBuffer first = mapping.slice(0, 3);
        ByteBuffer second = mapping.slice(3, 6);
        first.get();

        assertThat(first.isReadOnly()).isTrue();
        assertThat(second.position()).isZero();
        assertThat(text(second)).isEqualTo("def");
    }

    @Test
    void splitsIntoSegments() throws Exception {
        ByteMapping mapping = ByteMapping.open(write("0123456789"), 4);

        assertThat(mapping.segmentCount()).isEqualTo(3);
        assertThat(mapping.segmentOffset(0)).isZero();
        assertThat(mapping.segmentOffset(2)).isEqualTo(8);
        assertThat(mapping.segment(2).limit()).isEqualTo(2);
        assertThat(mapping.get(9)).isEqualTo((byte) '9');
    }

    @Test
    void sliceSpanningSegmentsIsCopied() throws Exception {
        ByteMapping mapping = ByteMapping.open(write("0123456789"), 4);

        assertThat(text(mapping.slice(2, 10))).isEqualTo("23456789");
        assertThat(text(mapping.slice(3, 5))).isEqualTo("34");
        assertThat(text(mapping.slice(4, 8))).isEqualTo("4567");
        assertThat(mapping.slice(2, 10).isReadOnly()).isTrue();
    }

    @Test
    void emptyFileHasNoSegments() throws Exception {
        ByteMapping mapping = ByteMapping.open(write(""));

        assertThat(mapping.length()).isZero();
        assertThat(mapping.segmentCount()).isZero();
        assertThat(mapping.slice(0, 0).remaining()).isZero();
    }

    @Test
    void rejectsOutOfBoundsAccess() throws Exception {
        ByteMapping mapping = ByteMapping.open(write("abc"));

        assertThatThrownBy(() -> mapping.slice(1, 4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> mapping.slice(2, 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> mapping.slice(-1, 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> mapping.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> mapping.segment(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void missingFileIsNotFound() {
        Path missing = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> ByteMapping.open(missing))
                .isInstanceOfSatisfying(GridFileException.class,
                        e -> assertThat(e.kind()).isEqualTo(GridFileException.Kind.NOT_FOUND))
                .hasMessageContaining("missing.csv");
    }

    @Test
    void directoryIsIoError() {
        assertThatThrownBy(() -> ByteMapping.open(tempDir))
                .isInstanceOfSatisfying(GridFileException.class,
                        e -> assertThat(e.kind()).isEqualTo(GridFileException.Kind.IO_ERROR));
    }

    @Test
    void rejectsNonPositiveSegmentSize() throws Exception {
        Path file = write("abc");

        assertThatThrownBy(() -> ByteMapping.open(file, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tooManySegmentsIsIoError() throws Exception {
        Path file = sparse(3L << 30);

        assertThatThrownBy(() -> ByteMapping.open(file, 1))
                .isInstanceOfSatisfying(GridFileException.class, e -> {
                    assertThat(e.kind()).isEqualTo(GridFileException.Kind.IO_ERROR);
                    assertThat(e.path()).isEqualTo(file);
                })
                .hasMessageContaining("segment size 1");
    }

    @Test
    void segmentSizeFromSystemProperty() {
        String previous = System.getProperty(ByteMapping.SEGMENT_SIZE_PROPERTY);
        try {
            System.setProperty(ByteMapping.SEGMENT_SIZE_PROPERTY, "4096");
            assertThat(ByteMapping.configuredSegmentSize()).isEqualTo(4096);

            System.setProperty(ByteMapping.SEGMENT_SIZE_PROPERTY, "not-a-number");
            assertThat(ByteMapping.configuredSegmentSize()).isEqualTo(ByteMapping.DEFAULT_SEGMENT_SIZE);

            System.setProperty(ByteMapping.SEGMENT_SIZE_PROPERTY, "-1");
            assertThat(ByteMapping.configuredSegmentSize()).isEqualTo(ByteMapping.DEFAULT_SEGMENT_SIZE);
        }
        finally {
            if (previous == null) {
                System.clearProperty(ByteMapping.SEGMENT_SIZE_PROPERTY);
            }
            else {
                System.setProperty(ByteMapping.SEGMENT_SIZE_PROPERTY, previous);
            }
        }
    }

    private Path write(String content) throws Exception {
        Path file = Files.createTempFile(tempDir, "mapping", ".csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private Path sparse(long length) throws Exception {
        Path file = Files.createTempFile(tempDir, "sparse", ".csv");
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.setLength(length);
        }
        return file;
    }

    private static String text(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
