/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that manages shared resources for opening grid sessions.
 * <p>
 * Holds the thread pool on which sessions are opened and indexed, so that the one-time
 * scan of a large file never runs on a latency-sensitive caller thread. The context
 * lifecycle is tied to the {@link Gridwood} instance that created it.
 * </p>
 */
public final class GridwoodContext implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(GridwoodContext.class.getName());

    private final ExecutorService executor;

    private GridwoodContext(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Create a new context with a thread pool sized to available processors.
     */
    public static GridwoodContext create() {
        return create(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     *
     * @throws IllegalArgumentException if {@code threads} is not positive
     */
    public static GridwoodContext create(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "gridwood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads", threads);
        return new GridwoodContext(executor);
    }

    /**
     * Get the executor service for opening sessions.
     */
    public ExecutorService executor() {
        return executor;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
