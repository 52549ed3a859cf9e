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

package com.amazon.anomalyensemble.runner;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.config.CombinationRule;
import com.amazon.anomalyensemble.config.EnsembleConfig;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    private static List<String> ruleNames(EnsembleConfig config) {
        return config.getCombinationRules().stream().map(CombinationRule::getName).collect(Collectors.toList());
    }

    @Test
    public void testNew() {
        assertEquals(0.05, parser.getContamination());
        assertEquals(80.0, parser.getPercentileLower());
        assertEquals(100.0, parser.getPercentileUpper());
        assertEquals(2.0, parser.getPercentileStep());
        assertEquals(3, parser.getVoteWeights().size());
        assertTrue(parser.getUnion());
        assertTrue(parser.getIntersection());
        assertEquals(100, parser.getNumberOfTrees());
        assertEquals(256, parser.getSampleSize());
        assertEquals(42, parser.getRandomSeed());
        assertArrayEquals(new int[] { 32, 16, 8, 16, 32 }, parser.getHiddenLayers());
        assertTrue(parser.getSuspectValidation());
        assertEquals(95.0, parser.getValidationPercentile());
        assertEquals(1, parser.getThreads());
        assertEquals("ServerMachineDataset", parser.getDataDirectory());
    }

    @Test
    public void testDefaultConfig() {
        EnsembleConfig config = parser.toConfig();
        assertEquals(EnsembleConfig.DEFAULT_RULES, config.getCombinationRules());
        assertEquals(10, config.getPercentileSweep().size());
        assertTrue(config.isSuspectValidationEnabled());
        assertTrue(config.isStandardize());
        assertFalse(config.isOneClassSvmEnabled());
        assertNull(config.oneClassSvmFactory());
    }

    @Test
    public void testParseOneClassSvm() {
        parser.parse("--one-class-svm", "true", "--nu", "0.1");

        EnsembleConfig config = parser.toConfig();
        assertTrue(config.isOneClassSvmEnabled());
        assertEquals(0.1, config.oneClassSvmFactory().get().getNu());
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--nu", "1.5"));
    }

    @Test
    public void testParse() {
        parser.parse("--contamination", "0.1", "--percentile-lower", "90", "--percentile-step", "1",
                "--vote-weights", "0.6:0.4", "--intersection", "false", "--number-of-trees", "50",
                "--hidden-layers", "8, 4, 8", "--suspect-validation", "false", "--threads", "4");

        assertEquals(0.1, parser.getContamination());
        assertEquals(50, parser.getNumberOfTrees());
        assertArrayEquals(new int[] { 8, 4, 8 }, parser.getHiddenLayers());

        EnsembleConfig config = parser.toConfig();
        assertEquals(10, config.getPercentileSweep().size());
        assertEquals(90.0, config.getPercentileSweep().getPercentiles()[0]);
        assertEquals(List.of("union", "vote(0.6:0.4)"), ruleNames(config));
        assertFalse(config.isSuspectValidationEnabled());
        assertEquals(4, config.getThreads());
        assertEquals(0.1, config.getContamination());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-c", "0.02", "-n", "20", "-s", "64", "-e", "3", "-b", "16", "-t", "2", "-v", "none", "-d",
                "/tmp/smd", "-o", "run1");

        assertEquals(0.02, parser.getContamination());
        assertEquals(20, parser.getNumberOfTrees());
        assertEquals(64, parser.getSampleSize());
        assertEquals(3, parser.getEpochs());
        assertEquals(16, parser.getBatchSize());
        assertEquals(2, parser.getThreads());
        assertTrue(parser.getVoteWeights().isEmpty());
        assertEquals("/tmp/smd", parser.getDataDirectory());
        assertEquals("run1", parser.getOutputPrefix());
        assertEquals(List.of("union", "intersection"), ruleNames(parser.toConfig()));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--no-such-flag", "1"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--epochs"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--contamination", "0.9"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--vote-weights", "0.5"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--hidden-layers", "8,0"));
        assertThrows(NumberFormatException.class, () -> parser.parse("--threads", "many"));
    }

    @Test
    public void testPercentileBoundsMustBeOrdered() {
        assertThrows(IllegalArgumentException.class,
                () -> new ArgumentParser("r", "d").parse("--percentile-lower", "99", "--percentile-upper", "90"));
    }
}
