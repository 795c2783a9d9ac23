/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

/**
 * Describes how fields are separated within a row.
 *
 * <p>Rows are always separated by a single line-feed byte. Fields are separated by a single
 * ASCII delimiter byte; there is no quoting, so a field can never contain the delimiter.
 * Carriage returns are not stripped and stay part of the last field of a line.</p>
 *
 * <pre>{@code
 * GridFormat.csv()              // comma, the default
 * GridFormat.tsv()              // tab
 * GridFormat.delimitedBy('|')   // any other ASCII byte
 * }</pre>
 */
public final class GridFormat {

    private static final GridFormat CSV = new GridFormat((byte) ',');
    private static final GridFormat TSV = new GridFormat((byte) '\t');

    private final byte delimiter;

    private GridFormat(byte delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Comma-separated fields.
     */
    public static GridFormat csv() {
        return CSV;
    }

    /**
     * Tab-separated fields.
     */
    public static GridFormat tsv() {
        return TSV;
    }

    /**
     * Fields separated by the given character.
     *
     * @throws IllegalArgumentException if the delimiter is not ASCII, or is a line-feed or carriage return
     */
    public static GridFormat delimitedBy(char delimiter) {
        if (delimiter > 0x7F) {
            throw new IllegalArgumentException("Delimiter must be an ASCII character: " + delimiter);
        }
        if (delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Delimiter must not be a line terminator");
        }
        if (delimiter == ',') {
            return CSV;
        }
        if (delimiter == '\t') {
            return TSV;
        }
        return new GridFormat((byte) delimiter);
    }

    public byte delimiter() {
        return delimiter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridFormat)) {
            return false;
        }
        return delimiter == ((GridFormat) o).delimiter;
    }

    @Override
    public int hashCode() {
        return Byte.hashCode(delimiter);
    }

    @Override
    public String toString() {
        return "GridFormat[delimiter=" + (delimiter == '\t' ? "\\t" : String.valueOf((char) delimiter)) + "]";
    }
}
