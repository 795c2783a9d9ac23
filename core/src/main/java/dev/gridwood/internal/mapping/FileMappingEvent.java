/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.mapping;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when Gridwood memory-maps a segment of a delimited file.
 * <p>
 * Memory-mapped I/O loads data through page faults rather than explicit read() calls,
 * so it does not show up in the standard {@code jdk.FileRead} event.
 * </p>
 */
@Name("dev.gridwood.FileMapping")
@Label("File Mapping")
@Category({"Gridwood", "I/O"})
@Description("Memory-mapping of a file segment for window queries")
public class FileMappingEvent extends Event {

    @Label("File Path")
    @Description("Path to the file being mapped")
    public String path;

    @Label("Offset")
    @Description("Starting offset in the file (bytes)")
    public long offset;

    @Label("Size")
    @Description("Size of the mapped region (bytes)")
    public long size;

    @Label("Segment")
    @Description("Index of the mapped segment within the file")
    public int segment;
}
