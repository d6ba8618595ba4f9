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

package dev.mars.actionflow.workflow;

import dev.mars.actionflow.config.ActionflowConfiguration;
import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.hcl.HclReader;
import dev.mars.actionflow.hcl.HclSyntaxException;
import dev.mars.actionflow.hcl.ObjectList;
import dev.mars.actionflow.model.Configuration;
import dev.mars.actionflow.workflow.observability.ParserMetrics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Workflow file parser for the block-structured {@code action "..." { }} /
 * {@code workflow "..." { }} syntax.
 *
 * <p>A parse runs the reader, then structural extraction, then validation, sorts the
 * diagnostics by line and finally applies the failure threshold from {@link ParserOptions}.
 * Instances hold no per-parse state and may be shared between threads.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * WorkflowFileParser parser = new HclWorkflowFileParser(ParserOptions.builder().suppressWarnings().build());
 * try {
 *     Configuration configuration = parser.parse(Path.of("main.workflow"));
 *     configuration.getWorkflows("push").forEach(...);
 * } catch (WorkflowParseException e) {
 *     e.getDiagnostics().forEach(d -> System.err.println(d.format()));
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public class HclWorkflowFileParser implements WorkflowFileParser {

    private static final Logger logger = Logger.getLogger(HclWorkflowFileParser.class.getName());

    private final ParserOptions options;
    private final ParserMetrics metrics;

    public HclWorkflowFileParser() {
        this(ParserOptions.defaults());
    }

    public HclWorkflowFileParser(ParserOptions options) {
        this(options, ParserMetrics.getInstance());
    }

    /**
     * @param metrics where to record parse metrics, or null to record none
     */
    public HclWorkflowFileParser(ParserOptions options, ParserMetrics metrics) {
        this.options = Objects.requireNonNull(options, "Parser options cannot be null");
        this.metrics = metrics;
    }

    public static HclWorkflowFileParser fromConfiguration(ActionflowConfiguration configuration) {
        ParserMetrics metrics = configuration.isMetricsEnabled() ? ParserMetrics.getInstance() : null;
        return new HclWorkflowFileParser(ParserOptions.fromConfiguration(configuration), metrics);
    }

    public ParserOptions getOptions() {
        return options;
    }

    @Override
    public Configuration parse(Path workflowFile) throws WorkflowParseException {
        long started = System.nanoTime();
        String fileName = options.getFileName().isEmpty() ? workflowFile.toString() : options.getFileName();
        String content;
        try {
            content = Files.readString(workflowFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warning("Failed to read workflow file " + workflowFile + ": " + e.getMessage());
            if (metrics != null) {
                metrics.recordParseError("io");
            }
            throw new WorkflowParseException(fileName, "Failed to read workflow file: " + workflowFile, e);
        }
        return check(analyse(content, fileName), fileName, started);
    }

    @Override
    public Configuration parseFromString(String content) throws WorkflowParseException {
        long started = System.nanoTime();
        return check(analyse(content, options.getFileName()), options.getFileName(), started);
    }

    @Override
    public Configuration parse(ObjectList root) throws WorkflowParseException {
        long started = System.nanoTime();
        return check(analyse(root, options.getFileName()), options.getFileName(), started);
    }

    @Override
    public List<Diagnostic> validate(String content) {
        return analyse(content, options.getFileName()).getDiagnostics();
    }

    @Override
    public DependencyGraph buildDependencyGraph(Configuration configuration) {
        return DependencyGraph.of(configuration);
    }

    private Configuration analyse(String content, String fileName) {
        ObjectList root;
        try {
            root = new HclReader(content, fileName).read();
        } catch (HclSyntaxException e) {
            logger.fine(() -> "Syntax error at " + e.getPosition() + ": " + e.getMessage());
            return Configuration.empty(List.of(Diagnostic.fatal(e.getPosition(), e.getMessage())));
        }
        return analyse(root, fileName);
    }

    private Configuration analyse(ObjectList root, String fileName) {
        ParseState state = new ParseState();
        new StructuralExtractor(state).extract(root);
        new ConfigurationValidator(state, options.getEventTypes()).validate();

        Configuration configuration = state.toConfiguration();
        if (fileName.isEmpty()) {
            return configuration;
        }
        List<Diagnostic> stamped = configuration.getDiagnostics().stream()
                .map(d -> d.getPosition().file().isEmpty()
                        ? new Diagnostic(d.getSeverity(), d.getPosition().withFile(fileName), d.getMessage())
                        : d)
                .toList();
        return new Configuration(configuration.getVersion(), configuration.getActions(),
                configuration.getWorkflows(), stamped);
    }

    private Configuration check(Configuration configuration, String fileName, long startedNanos)
            throws WorkflowParseException {
        Severity threshold = options.getFailureThreshold();
        boolean failed = configuration.firstDiagnostic(threshold).isPresent();

        if (metrics != null) {
            metrics.recordParse(!failed, (System.nanoTime() - startedNanos) / 1_000_000_000.0,
                    configuration.getDiagnostics());
        }
        logger.fine(() -> String.format("Parsed %s: %d action(s), %d workflow(s), %d diagnostic(s), %s",
                fileName.isEmpty() ? "<string>" : fileName,
                configuration.getActions().size(),
                configuration.getWorkflows().size(),
                configuration.getDiagnostics().size(),
                failed ? "failed" : "ok"));

        if (failed) {
            throw new WorkflowParseException(fileName, configuration);
        }
        return configuration;
    }
}
