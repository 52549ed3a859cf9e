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

package com.amazon.anomalyensemble.examples.comparison;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.data.DatasetLoader;
import com.amazon.anomalyensemble.examples.Example;
import com.amazon.anomalyensemble.examples.report.MetricsTableWriter;
import com.amazon.anomalyensemble.runner.ArgumentParser;
import com.amazon.anomalyensemble.runner.EvaluationReport;
import com.amazon.anomalyensemble.runner.MultiDatasetRunner;

/**
 * Runs every strategy over the datasets of one loader, prints the comparison
 * and writes {@code <prefix>.csv} and {@code <prefix>.json}.
 */
public abstract class ComparisonExample implements Example {

    private static final Logger LOG = LogManager.getLogger(ComparisonExample.class);

    private final MetricsTableWriter writer = new MetricsTableWriter();

    protected abstract DatasetLoader createLoader(ArgumentParser parser);

    @Override
    public void run(String... args) throws Exception {
        ArgumentParser parser = new ArgumentParser(getClass().getName(), description());
        parser.parseOrExit(args);
        EvaluationReport report = compare(createLoader(parser), parser.toConfig());
        writer.print(report, System.out);
        export(report, parser.getOutputPrefix());
    }

    public EvaluationReport compare(DatasetLoader loader, EnsembleConfig config) throws IOException {
        MultiDatasetRunner runner = MultiDatasetRunner.fromConfig(loader, config);
        EvaluationReport report = runner.run();
        if (report.getTable().isEmpty()) {
            LOG.warn("no dataset could be evaluated");
        }
        return report;
    }

    void export(EvaluationReport report, String prefix) throws IOException {
        if (prefix == null || prefix.isEmpty()) {
            return;
        }
        Path csv = Paths.get(prefix + ".csv");
        Path json = Paths.get(prefix + ".json");
        writer.writeCsv(report.getTable(), csv);
        writer.writeJson(report, json);
        System.out.printf("%nwrote %s and %s%n", csv, json);
    }
}
