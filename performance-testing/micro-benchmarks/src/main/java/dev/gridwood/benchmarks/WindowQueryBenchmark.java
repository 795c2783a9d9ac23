/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.benchmarks;

import java.io.IOException;
import java.nio.file.Path;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.gridwood.reader.GridSession;
import dev.gridwood.testdata.GridDataGenerator;

/**
 * Measures window queries at random positions of an already opened session,
 * sized like a scrolling viewport.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class WindowQueryBenchmark {

    @Param("target/grid-data")
    private String dataDir;

    @Param("1000000")
    private long rows;

    @Param("20")
    private int cols;

    @Param({ "60" })
    private int rowCount;

    @Param({ "6" })
    private int colCount;

    private GridSession session;

    @State(Scope.Thread)
    public static class Cursor {

        private final SplittableRandom random = new SplittableRandom(42);
        long rowStart;
        long colStart;

        @Setup(Level.Invocation)
        public void next(WindowQueryBenchmark benchmark) {
            rowStart = random.nextLong(Math.max(1, benchmark.session.totalRows()));
            colStart = random.nextLong(Math.max(1, benchmark.session.totalCols()));
        }
    }

    @Setup
    public void setup() throws IOException {
        Path path = GridDataGenerator.generate(Path.of(dataDir), rows, cols);
        session = GridSession.open(path);
    }

    @Benchmark
    public void gridChunk(Cursor cursor, Blackhole blackhole) {
        blackhole.consume(session.getGridChunk(cursor.rowStart, rowCount, cursor.colStart, colCount));
    }

    @Benchmark
    @Threads(4)
    public void gridChunkConcurrent(Cursor cursor, Blackhole blackhole) {
        blackhole.consume(session.getGridChunk(cursor.rowStart, rowCount, cursor.colStart, colCount));
    }

    @Benchmark
    public void headerChunk(Cursor cursor, Blackhole blackhole) {
        blackhole.consume(session.getHeaderChunk(cursor.colStart, colCount));
    }
}
