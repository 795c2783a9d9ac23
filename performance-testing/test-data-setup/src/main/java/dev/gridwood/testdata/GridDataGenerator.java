/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.testdata;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Generates large comma-separated files for performance testing.
 * <p>
 * Every cell is derived from its position, e.g. {@code "r12c3"}, so readers can verify any
 * window without keeping the file contents around. Every tenth row is ragged: it has one
 * field fewer than the header row.
 * </p>
 */
public final class GridDataGenerator {

    public static final long DEFAULT_ROWS = 1_000_000;
    public static final int DEFAULT_COLS = 20;
    public static final Path DATA_DIR = Path.of("target/grid-data");

    public static void main(String[] args) throws IOException {
        Path dataDir = getDataDirFromProperty();
        long rows = getLongProperty("gen.rows", DEFAULT_ROWS);
        int cols = (int) getLongProperty("gen.cols", DEFAULT_COLS);
        System.out.println("Generating " + rows + " rows x " + cols + " columns");
        Path file = generate(dataDir, rows, cols);
        System.out.println("Generation complete: " + file.toAbsolutePath() + " (" + Files.size(file) + " bytes)");
    }

    public static String formatFilename(long rows, int cols) {
        return String.format("grid_%dx%d.csv", rows, cols);
    }

    /**
     * Expected content of a cell, or the empty string where the row is ragged.
     */
    public static String cell(long row, int col, int cols) {
        if (isRagged(row) && col == cols - 1) {
            return "";
        }
        return "r" + row + "c" + col;
    }

    public static boolean isRagged(long row) {
        return row > 0 && row % 10 == 0;
    }

    /**
     * Writes {@code rows} rows of {@code cols} columns into {@code dataDir}, unless a file of that
     * shape already exists there.
     *
     * @return the generated file
     */
    public static Path generate(Path dataDir, long rows, int cols) throws IOException {
        if (rows < 0 || cols <= 0) {
            throw new IllegalArgumentException("Invalid shape: " + rows + " x " + cols);
        }
        Files.createDirectories(dataDir);
        Path target = dataDir.resolve(formatFilename(rows, cols));
        if (Files.exists(target) && Files.size(target) > 0) {
            return target;
        }

        Path partial = dataDir.resolve(target.getFileName() + ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
            StringBuilder line = new StringBuilder();
            for (long row = 0; row < rows; row++) {
                line.setLength(0);
                int fields = isRagged(row) ? cols - 1 : cols;
                for (int col = 0; col < fields; col++) {
                    if (col > 0) {
                        line.append(',');
                    }
                    line.append('r').append(row).append('c').append(col);
                }
                line.append('\n');
                writer.append(line);
            }
        }
        return Files.move(partial, target);
    }

    private static Path getDataDirFromProperty() {
        String property = System.getProperty("data.dir");
        if (property == null || property.isBlank()) {
            return DATA_DIR;
        }
        return Path.of(property);
    }

    private static long getLongProperty(String name, long defaultValue) {
        String property = System.getProperty(name);
        if (property == null || property.isBlank()) {
            return defaultValue;
        }
        return Long.parseLong(property.trim());
    }

    private GridDataGenerator() {
    }
}
