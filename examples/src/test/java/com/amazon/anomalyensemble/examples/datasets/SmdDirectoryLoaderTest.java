/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyensemble.examples.datasets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.anomalyensemble.data.Dataset;
import com.amazon.anomalyensemble.exception.InvalidDatasetException;
import com.amazon.anomalyensemble.returntypes.DecisionVector;

public class SmdDirectoryLoaderTest {

    @TempDir
    Path root;

    private SmdDirectoryLoader loader;

    private void write(String directory, String machine, String content) throws IOException {
        Path dir = root.resolve(directory);
        Files.createDirectories(dir);
        Files.write(dir.resolve(machine + ".txt"), content.getBytes(StandardCharsets.UTF_8));
    }

    private void writeMachine(String machine) throws IOException {
        write("train", machine, "0.1,0.2\n0.3,0.4\n0.5,0.6\n");
        write("test", machine, "0.1,0.2\n0.9,0.9\n");
        write("test_label", machine, "0\n1\n");
    }

    @BeforeEach
    public void setUp() {
        loader = new SmdDirectoryLoader(root);
    }

    @Test
    public void testListsMachinesSorted() throws IOException {
        writeMachine("machine-2-1");
        writeMachine("machine-1-2");
        writeMachine("machine-1-1");
        Files.write(root.resolve("train").resolve("README.md"), new byte[0]);

        assertThat(loader.listDatasetIds(), contains("machine-1-1", "machine-1-2", "machine-2-1"));
    }

    @Test
    public void testLoad() throws IOException {
        writeMachine("machine-1-1");

        Dataset dataset = loader.load("machine-1-1");

        assertEquals("machine-1-1", dataset.getId());
        assertEquals(3, dataset.getTrainSize());
        assertEquals(2, dataset.getDimensions());
        assertArrayEquals(new double[] { 0.9, 0.9 }, dataset.getTest()[1]);
        assertEquals(DecisionVector.of(0, 1), dataset.getLabels());
    }

    @Test
    public void testMissingLabelFile() throws IOException {
        write("train", "m", "1,2\n");
        write("test", "m", "1,2\n");
        assertThrows(NoSuchFileException.class, () -> loader.load("m"));
    }

    @Test
    public void testMalformedFiles() throws IOException {
        write("train", "m", "1,2\n3,x\n");
        write("test", "m", "1,2\n");
        write("test_label", "m", "0\n");
        assertThrows(InvalidDatasetException.class, () -> loader.load("m"));

        write("train", "m", "1,2\n3,4\n");
        write("test_label", "m", "2\n");
        assertThrows(InvalidDatasetException.class, () -> loader.load("m"));

        write("test_label", "m", "0\n1\n");
        assertThrows(InvalidDatasetException.class, () -> loader.load("m"));
    }

    @Test
    public void testMissingTrainDirectory() {
        assertThrows(IOException.class, () -> loader.listDatasetIds());
    }
}
