/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for hosts that open grid sessions.
 *
 * <p>The host creates one instance before first use and closes it at shutdown. There is no
 * process-wide initialization and no global state; everything lives in the instance:</p>
 * <pre>{@code
 * try (Gridwood gridwood = Gridwood.create()) {
 *     gridwood.openAsync(path).thenAccept(session -> {
 *         List<RowData> rows = session.getGridChunk(0, 60, 0, 6);
 *         // ...
 *     });
 * }
 * }</pre>
 *
 * <p>For one-off synchronous use, {@link GridSession#open(Path)} is simpler.</p>
 */
public class Gridwood implements AutoCloseable {

    private final GridwoodContext context;

    private Gridwood(GridwoodContext context) {
        this.context = context;
    }

    /**
     * Create a new Gridwood instance with a thread pool sized to available processors.
     */
    public static Gridwood create() {
        return new Gridwood(GridwoodContext.create());
    }

    /**
     * Create a new Gridwood instance with a thread pool of the specified size.
     */
    public static Gridwood create(int threads) {
        return new Gridwood(GridwoodContext.create(threads));
    }

    /**
     * Open a comma-separated file on the calling thread.
     */
    public GridSession open(Path path) throws IOException {
        return open(path, GridFormat.csv());
    }

    /**
     * Open a delimited file on the calling thread.
     */
    public GridSession open(Path path, GridFormat format) throws IOException {
        return GridSession.open(path, format);
    }

    /**
     * Open a comma-separated file on the context's thread pool.
     *
     * @return a future completed with the session, or completed exceptionally with a
     *         {@link GridFileException} if the file cannot be opened
     */
    public CompletableFuture<GridSession> openAsync(Path path) {
        return openAsync(path, GridFormat.csv());
    }

    /**
     * Open a delimited file on the context's thread pool.
     *
     * @return a future completed with the session, or completed exceptionally with a
     *         {@link GridFileException} if the file cannot be opened
     */
    public CompletableFuture<GridSession> openAsync(Path path, GridFormat format) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return GridSession.open(path, format);
            }
            catch (IOException e) {
                throw new CompletionException(e);
            }
        }, context.executor());
    }

    /**
     * Create a synthetic session of the given size.
     *
     * @see GridSession#demo(long, long)
     */
    public GridSession demo(long totalRows, long totalCols) {
        return GridSession.demo(totalRows, totalCols);
    }

    /**
     * Get the executor service used by this instance.
     */
    public ExecutorService executor() {
        return context.executor();
    }

    @Override
    public void close() {
        context.close();
    }
}
