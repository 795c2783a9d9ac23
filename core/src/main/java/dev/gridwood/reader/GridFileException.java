/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Raised when a delimited file cannot be opened or mapped.
 * <p>
 * This is the only failure a grid session can report. It happens while the
 * session is being created; once a session exists, its queries never fail.
 * </p>
 */
public class GridFileException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Why the file could not be opened.
     */
    public enum Kind {
        /** The path does not exist. */
        NOT_FOUND,
        /** The path exists but may not be read. */
        PERMISSION_DENIED,
        /** The file was opened but its contents could not be mapped. */
        IO_ERROR
    }

    private final Kind kind;
    private final transient Path path;

    public GridFileException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    /**
     * Classifies an I/O failure raised while opening or mapping {@code path}.
     */
    public static GridFileException of(Path path, IOException e) {
        if (e instanceof GridFileException) {
            return (GridFileException) e;
        }
        if (e instanceof NoSuchFileException) {
            return new GridFileException(Kind.NOT_FOUND, path, "File not found: " + path, e);
        }
        if (e instanceof AccessDeniedException) {
            return new GridFileException(Kind.PERMISSION_DENIED, path, "Permission denied: " + path, e);
        }
        return new GridFileException(Kind.IO_ERROR, path, "Cannot map file " + path + ": " + e.getMessage(), e);
    }

    public Kind kind() {
        return kind;
    }

    public Path path() {
        return path;
    }
}
