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

package dev.mars.actionflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.actionflow.config.ActionflowConfiguration;
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.workflow.HclWorkflowFileParser;
import dev.mars.actionflow.workflow.ParserOptions;
import dev.mars.actionflow.workflow.WorkflowFileParser;
import dev.mars.actionflow.workflow.WorkflowParseException;
import dev.mars.actionflow.workflow.observability.ParserMetrics;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Command-line tool for validating workflow files.
 *
 * Usage:
 *   java ActionflowCli <main.workflow> [other.workflow] [...]
 *   java ActionflowCli --validate-directory <directory>
 *   java ActionflowCli --help
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 */
public class ActionflowCli {

    private static final Logger logger = Logger.getLogger(ActionflowCli.class.getName());

    static final int EXIT_VALID = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String VERSION = "1.0.0";
    private static final String WORKFLOW_SUFFIX = ".workflow";
    private static final String USAGE = """
            Actionflow Workflow Validator v%s

            USAGE:
              java ActionflowCli <file1.workflow> [file2.workflow] [...]
              java ActionflowCli --validate-directory <directory>
              java ActionflowCli --help
              java ActionflowCli --version

            OPTIONS:
              --help                    Show this help message
              --version                 Show version information
              --validate-directory DIR  Validate all .workflow files in directory
              --suppress-warnings       Warnings do not make a file invalid
              --suppress-errors         Only fatal problems make a file invalid
              --quiet                   Only report invalid files
              --format FORMAT           Output format: text, json or yaml

            EXIT CODES:
              0  All files are valid
              1  At least one file is invalid
              2  Invalid command line arguments
              3  File not found or IO error
            """.formatted(VERSION);

    private final ActionflowConfiguration configuration;
    private final PrintStream out;
    private final PrintStream err;

    private Severity threshold;
    private ReportRenderer.Format format;
    private boolean quiet;

    public ActionflowCli(ActionflowConfiguration configuration, PrintStream out, PrintStream err) {
        this.configuration = configuration;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        ActionflowCli cli = new ActionflowCli(new ActionflowConfiguration(), System.out, System.err);
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No files specified");
            err.println();
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return processArguments(List.of(args));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private int processArguments(List<String> args) throws IOException {
        if (args.contains("--help") || args.contains("-h")) {
            out.println(USAGE);
            return EXIT_VALID;
        }
        if (args.contains("--version") || args.contains("-v")) {
            out.println("Actionflow Workflow Validator v" + VERSION);
            return EXIT_VALID;
        }

        threshold = configuration.getFailureThreshold();
        format = parseFormat(configuration.getOutputFormat());
        quiet = false;

        List<String> files = new ArrayList<>();
        String directory = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--suppress-warnings" -> threshold = max(threshold, Severity.ERROR);
                case "--suppress-errors" -> threshold = Severity.FATAL;
                case "--quiet" -> quiet = true;
                case "--format" -> format = parseFormat(requireValue(args, ++i, arg));
                case "--validate-directory" -> directory = requireValue(args, ++i, arg);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + arg);
                    }
                    files.add(arg);
                }
            }
        }

        if (directory != null) {
            files.addAll(findWorkflowFiles(Paths.get(directory)));
        } else if (files.isEmpty()) {
            throw new IllegalArgumentException("No files to validate");
        }
        return validateFiles(files);
    }

    private static String requireValue(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args.get(index);
    }

    private static ReportRenderer.Format parseFormat(String value) {
        try {
            return ReportRenderer.Format.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format '" + value + "', expected text, json or yaml");
        }
    }

    private static Severity max(Severity a, Severity b) {
        return a.isAtLeast(b) ? a : b;
    }

    private List<String> findWorkflowFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(WORKFLOW_SUFFIX))
                    .sorted()
                    .map(Path::toString)
                    .toList();
        }
    }

    private int validateFiles(List<String> files) throws JsonProcessingException {
        ParserMetrics metrics = configuration.isMetricsEnabled() ? ParserMetrics.getInstance() : null;
        ParserOptions baseOptions = ParserOptions.fromConfiguration(configuration).toBuilder()
                .failureThreshold(threshold)
                .build();

        List<FileReport> reports = new ArrayList<>();
        for (String file : files) {
            WorkflowFileParser parser = new HclWorkflowFileParser(baseOptions.toBuilder().fileName(file).build(), metrics);
            reports.add(validateFile(parser, file));
        }

        new ReportRenderer(format, quiet).render(reports, out, err);

        if (reports.stream().anyMatch(FileReport::isUnreadable)) {
            return EXIT_IO;
        }
        return reports.stream().allMatch(FileReport::valid) ? EXIT_VALID : EXIT_INVALID;
    }

    private FileReport validateFile(WorkflowFileParser parser, String file) {
        try {
            return FileReport.valid(file, parser.parse(Paths.get(file)));
        } catch (WorkflowParseException e) {
            if (e.getConfiguration() == null) {
                logger.fine(() -> "Could not read " + file + ": " + e.getCause());
                String reason = e.getCause() instanceof NoSuchFileException
                        ? "No such file"
                        : "Failed to read workflow file";
                return FileReport.unreadable(file, reason);
            }
            return FileReport.invalid(file, e.getConfiguration());
        }
    }
}
