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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.actionflow.diagnostic.Diagnostic;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes file reports as plain text, JSON or YAML.
 *
 * <p>Text mode prints one line per valid file, or one {@code file:line:col: SEVERITY: message}
 * line per diagnostic. JSON and YAML modes print a single document holding every report.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
class ReportRenderer {

    enum Format {
        TEXT, JSON, YAML;

        static Format fromString(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Format format;
    private final boolean quiet;
    private final ObjectMapper objectMapper;
    private final Yaml yaml;

    ReportRenderer(Format format, boolean quiet) {
        this.format = format;
        this.quiet = quiet;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setIndent(2);
        this.yaml = new Yaml(dumperOptions);
    }

    void render(List<FileReport> reports, PrintStream out, PrintStream err) throws JsonProcessingException {
        switch (format) {
            case JSON -> out.println(objectMapper.writeValueAsString(toDocument(reports)));
            case YAML -> out.print(yaml.dump(toDocument(reports)));
            default -> reports.forEach(report -> renderText(report, out, err));
        }
    }

    private void renderText(FileReport report, PrintStream out, PrintStream err) {
        if (report.isUnreadable()) {
            err.println(report.file() + ": " + report.ioError());
            return;
        }
        if (report.valid()) {
            if (quiet) {
                return;
            }
            report.diagnostics().forEach(d -> out.println(formatDiagnostic(report.file(), d)));
            out.println(report.file() + " is a valid file with " + plural(report.actions(), "action")
                    + " and " + plural(report.workflows(), "workflow"));
            return;
        }
        report.diagnostics().forEach(d -> out.println(formatDiagnostic(report.file(), d)));
    }

    static String formatDiagnostic(String file, Diagnostic diagnostic) {
        String location = diagnostic.getPosition().file().isEmpty() ? file : diagnostic.getPosition().file();
        return location + ":" + diagnostic.getPosition().line() + ":" + diagnostic.getPosition().column()
                + ": " + diagnostic.getSeverity() + ": " + diagnostic.getMessage();
    }

    static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    private Map<String, Object> toDocument(List<FileReport> reports) {
        List<Map<String, Object>> files = new ArrayList<>();
        int invalid = 0;
        for (FileReport report : reports) {
            if (!report.valid()) {
                invalid++;
            }
            files.add(toMap(report));
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("files", files);
        document.put("checked", reports.size());
        document.put("invalid", invalid);
        return document;
    }

    private Map<String, Object> toMap(FileReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", report.file());
        map.put("valid", report.valid());
        if (report.isUnreadable()) {
            map.put("error", report.ioError());
            return map;
        }
        map.put("actions", report.actions());
        map.put("workflows", report.workflows());

        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : report.diagnostics()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("severity", diagnostic.getSeverity().name());
            entry.put("line", diagnostic.getPosition().line());
            entry.put("column", diagnostic.getPosition().column());
            entry.put("message", diagnostic.getMessage());
            diagnostics.add(entry);
        }
        map.put("diagnostics", diagnostics);
        return map;
    }
}
