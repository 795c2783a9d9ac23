/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.internal.index;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;
import jdk.jfr.StackTrace;

/**
 * JFR event emitted for the one-time line index scan of a mapped file.
 * <p>
 * The scan touches every byte of the file, so its duration is the dominant
 * cost of opening a session.
 * </p>
 */
@Name("dev.gridwood.LineIndex")
@Label("Line Index")
@Category({"Gridwood", "Indexing"})
@Description("Scan of a mapped file recording the start offset of every row")
@StackTrace(false)
public class LineIndexEvent extends Event {

    @Label("File Path")
    @Description("Path to the indexed file")
    public String path;

    @Label("Bytes Scanned")
    @Description("Number of bytes scanned for line feeds")
    public long bytes;

    @Label("Rows")
    @Description("Number of rows found")
    public long rows;
}
