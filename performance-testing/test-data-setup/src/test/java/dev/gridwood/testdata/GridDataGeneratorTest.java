/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.gridwood.testdata;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridDataGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void writesRowsDerivedFromPosition() throws Exception {
        Path file = GridDataGenerator.generate(tempDir, 12, 3);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

        assertThat(file.getFileName().toString()).isEqualTo("grid_12x3.csv");
        assertThat(lines).hasSize(12);
        assertThat(lines.get(0)).isEqualTo("r0c0,r0c1,r0c2");
        assertThat(lines.get(10)).isEqualTo("r10c0,r10c1");
        assertThat(lines.get(11)).isEqualTo("r11c0,r11c1,r11c2");
        assertThat(GridDataGenerator.cell(10, 2, 3)).isEmpty();
        assertThat(GridDataGenerator.cell(11, 2, 3)).isEqualTo("r11c2");
    }

    @Test
    void reusesExistingFile() throws Exception {
        Path first = GridDataGenerator.generate(tempDir, 5, 2);
        long modified = Files.getLastModifiedTime(first).toMillis();

        Path second = GridDataGenerator.generate(tempDir, 5, 2);

        assertThat(second).isEqualTo(first);
        assertThat(Files.getLastModifiedTime(second).toMillis()).isEqualTo(modified);
    }

    @Test
    void rejectsInvalidShape() {
        assertThatThrownBy(() -> GridDataGenerator.generate(tempDir, 5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
