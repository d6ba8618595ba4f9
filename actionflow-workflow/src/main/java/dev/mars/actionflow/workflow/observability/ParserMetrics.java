/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionflow.workflow.observability;

import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.diagnostic.Severity;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Actionflow workflow file parser.
 *
 * Provides 4 parser metrics:
 * - actionflow.parse.total (counter) - Workflow files parsed
 * - actionflow.parse.failed (counter) - Parses that failed the severity threshold
 * - actionflow.parse.diagnostics (counter) - Diagnostics reported, by severity
 * - actionflow.parse.duration.seconds (histogram) - Parse duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0 (OpenTelemetry)
 */
public class ParserMetrics {

    private static final Logger logger = Logger.getLogger(ParserMetrics.class.getName());
    private static final String METER_NAME = "actionflow-workflow";

    // Singleton instance
    private static ParserMetrics instance;

    // Counters
    private final LongCounter parsesTotal;
    private final LongCounter parsesFailed;
    private final LongCounter diagnosticsTotal;

    // Histograms
    private final DoubleHistogram parseDuration;

    // Attribute keys
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("severity");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private ParserMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    /**
     * Creates metrics on a specific meter, e.g. one backed by an in-memory reader in tests.
     */
    public ParserMetrics(Meter meter) {
        // Initialize counters
        parsesTotal = meter.counterBuilder("actionflow.parse.total")
                .setDescription("Total number of workflow files parsed")
                .setUnit("1")
                .build();

        parsesFailed = meter.counterBuilder("actionflow.parse.failed")
                .setDescription("Number of workflow file parses that failed")
                .setUnit("1")
                .build();

        diagnosticsTotal = meter.counterBuilder("actionflow.parse.diagnostics")
                .setDescription("Number of diagnostics reported while parsing")
                .setUnit("1")
                .build();

        // Initialize histograms
        parseDuration = meter.histogramBuilder("actionflow.parse.duration.seconds")
                .setDescription("Workflow file parse duration in seconds")
                .setUnit("s")
                .build();

        logger.fine("ParserMetrics initialized");
    }

    /**
     * Get the singleton instance of ParserMetrics.
     */
    public static synchronized ParserMetrics getInstance() {
        if (instance == null) {
            instance = new ParserMetrics();
        }
        return instance;
    }

    /**
     * Record a completed parse, successful or not.
     */
    public void recordParse(boolean succeeded, double durationSeconds, List<Diagnostic> diagnostics) {
        Attributes attrs = Attributes.of(OUTCOME_KEY, succeeded ? "success" : "failure");
        parsesTotal.add(1, attrs);
        parseDuration.record(durationSeconds, attrs);

        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Diagnostic diagnostic : diagnostics) {
            counts.merge(diagnostic.getSeverity(), 1L, Long::sum);
        }
        counts.forEach((severity, count) ->
                diagnosticsTotal.add(count, Attributes.of(SEVERITY_KEY, severity.name().toLowerCase(Locale.ROOT))));

        if (!succeeded) {
            Severity worst = counts.keySet().stream().max(Comparator.naturalOrder()).orElse(Severity.FATAL);
            parsesFailed.add(1, Attributes.of(FAILURE_REASON_KEY, worst.name().toLowerCase(Locale.ROOT)));
        }
    }

    /**
     * Record a parse that failed before any diagnostics could be produced, e.g. an unreadable file.
     */
    public void recordParseError(String failureReason) {
        parsesTotal.add(1, Attributes.of(OUTCOME_KEY, "failure"));
        parsesFailed.add(1, Attributes.of(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown"));
    }
}
