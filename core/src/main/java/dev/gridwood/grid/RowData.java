/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.grid;

import java.util.List;
import java.util.Objects;

/**
 * One row of a window query result.
 * <p>
 * The cells are detached from the file they were read from; holding on to a
 * {@code RowData} does not keep the underlying mapping alive, and the cell
 * list is an immutable copy of the one passed in.
 * </p>
 *
 * @param index zero-based row index within the file
 * @param cells the cell values of the requested column range, in column order
 */
public record RowData(long index, List<String> cells) {

    public RowData {
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }
}
