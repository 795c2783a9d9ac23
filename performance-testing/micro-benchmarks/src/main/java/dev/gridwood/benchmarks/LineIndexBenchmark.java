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
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.gridwood.reader.GridSession;
import dev.gridwood.testdata.GridDataGenerator;

/**
 * Measures opening a session: mapping the file and building the line index.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class LineIndexBenchmark {

    @Param("target/grid-data")
    private String dataDir;

    @Param("1000000")
    private long rows;

    @Param("20")
    private int cols;

    private Path path;

    @Setup
    public void setup() throws IOException {
        path = GridDataGenerator.generate(Path.of(dataDir), rows, cols).toAbsolutePath().normalize();
    }

    @Benchmark
    public void openAndIndex(Blackhole blackhole) throws IOException {
        GridSession session = GridSession.open(path);
        blackhole.consume(session.totalRows());
        blackhole.consume(session.totalCols());
    }
}
