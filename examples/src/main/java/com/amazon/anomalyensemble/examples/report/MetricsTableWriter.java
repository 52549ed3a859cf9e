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

package com.amazon.anomalyensemble.examples.report;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.anomalyensemble.returntypes.MetricRecord;
import com.amazon.anomalyensemble.returntypes.MetricsTable;
import com.amazon.anomalyensemble.returntypes.ThresholdCandidate;
import com.amazon.anomalyensemble.runner.EvaluationReport;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Prints an {@link EvaluationReport} and exports it as CSV and JSON.
 */
public class MetricsTableWriter {

    private static final Logger LOG = LogManager.getLogger(MetricsTableWriter.class);

    public static final String CSV_HEADER = "dataset,strategy,precision,recall,f1";

    private final ObjectMapper jsonMapper;

    public MetricsTableWriter() {
        this(new ObjectMapper());
    }

    public MetricsTableWriter(ObjectMapper jsonMapper) {
        this.jsonMapper = checkNotNull(jsonMapper, "jsonMapper must not be null");
    }

    /**
     * Writes one line per dataset and strategy, in table order. Text fields
     * containing a comma, a quote or a line break are quoted as in RFC 4180.
     */
    public void writeCsv(MetricsTable table, Writer writer) {
        PrintWriter out = new PrintWriter(writer);
        out.println(CSV_HEADER);
        for (MetricRecord record : table.getRecords()) {
            out.println(String.format(Locale.ROOT, "%s,%s,%.6f,%.6f,%.6f", csvField(record.getDatasetId()),
                    csvField(record.getStrategy()), record.getPrecision(), record.getRecall(), record.getF1()));
        }
        out.flush();
    }

    static String csvField(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0
                && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    public void writeCsv(MetricsTable table, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeCsv(table, writer);
        }
        LOG.info("wrote {} rows to {}", table.size(), file);
    }

    public ComparisonSummary summarize(EvaluationReport report) {
        MetricsTable table = report.getTable();
        ComparisonSummary summary = new ComparisonSummary();
        summary.setDatasetCount(table.getDatasetIds().size());
        summary.setStrategies(table.getStrategies());
        summary.setMeanPrecision(table.meanPrecision());
        summary.setMeanRecall(table.meanRecall());
        summary.setMeanF1(table.meanF1());
        summary.setBestStrategy(table.bestStrategy().orElse(null));

        Map<String, Double> percentiles = new LinkedHashMap<>();
        Map<String, Double> thresholds = new LinkedHashMap<>();
        for (Map.Entry<String, ThresholdCandidate> entry : report.getThresholds().entrySet()) {
            percentiles.put(entry.getKey(), entry.getValue().getPercentile());
            thresholds.put(entry.getKey(), entry.getValue().getThreshold());
        }
        summary.setReconstructionPercentiles(percentiles);
        summary.setReconstructionThresholds(thresholds);
        summary.setFailures(new LinkedHashMap<>(report.getFailures()));
        return summary;
    }

    public String toJson(EvaluationReport report) throws IOException {
        return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summarize(report));
    }

    public void writeJson(EvaluationReport report, Path file) throws IOException {
        Files.write(file, toJson(report).getBytes(StandardCharsets.UTF_8));
        LOG.info("wrote summary to {}", file);
    }

    /**
     * Prints the per dataset rows followed by the mean of every metric per
     * strategy.
     */
    public void print(EvaluationReport report, PrintStream out) {
        MetricsTable table = report.getTable();
        String rowFormat = "%-24s %-20s %9.4f %9.4f %9.4f%n";
        out.printf(Locale.ROOT, "%-24s %-20s %9s %9s %9s%n", "dataset", "strategy", "precision", "recall", "f1");
        for (MetricRecord record : table.getRecords()) {
            out.printf(Locale.ROOT, rowFormat, record.getDatasetId(), record.getStrategy(), record.getPrecision(),
                    record.getRecall(), record.getF1());
        }

        out.println();
        out.printf("mean over %d datasets%n", table.getDatasetIds().size());
        Map<String, Double> precision = table.meanPrecision();
        Map<String, Double> recall = table.meanRecall();
        for (Map.Entry<String, Double> entry : table.meanF1().entrySet()) {
            out.printf(Locale.ROOT, rowFormat, "", entry.getKey(), precision.get(entry.getKey()),
                    recall.get(entry.getKey()), entry.getValue());
        }
        table.bestStrategy().ifPresent(best -> out.printf("best strategy by mean f1: %s%n", best));

        if (report.hasFailures()) {
            out.println();
            out.printf("skipped %d datasets%n", report.getFailures().size());
            report.getFailures().forEach((id, reason) -> out.printf("\t%s: %s%n", id, reason));
        }
    }
}
