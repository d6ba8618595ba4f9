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

import dev.mars.actionflow.core.exceptions.ActionflowException;
import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.model.Configuration;

import java.util.List;

/**
 * Exception thrown when a workflow file fails to parse or validate.
 *
 * <p>A failure caused by diagnostics at or above the failure threshold carries the
 * partial {@link Configuration} and every diagnostic, sorted by line, so that callers
 * can still display a best-effort view of a broken file. A failure to read the file
 * carries only a cause.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowParseException extends ActionflowException {

    private final String fileName;
    private final int lineNumber;
    private final Configuration configuration;

    public WorkflowParseException(String message) {
        this(null, -1, message, null, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, -1, message, null, cause);
    }

    public WorkflowParseException(String fileName, String message, Throwable cause) {
        this(fileName, -1, message, null, cause);
    }

    /**
     * Failure caused by diagnostics. The message summarises the first diagnostic.
     *
     * @param fileName      the file being parsed, or null
     * @param configuration the partial model, with every diagnostic attached
     */
    public WorkflowParseException(String fileName, Configuration configuration) {
        this(fileName, firstLine(configuration), summarise(configuration), configuration, null);
    }

    private WorkflowParseException(String fileName, int lineNumber, String message,
                                   Configuration configuration, Throwable cause) {
        super(message, cause);
        this.fileName = fileName != null && !fileName.isEmpty() ? fileName : null;
        this.lineNumber = lineNumber;
        this.configuration = configuration;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Line of the first diagnostic, or -1 when unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * The partial model, or null when the file could not be read.
     */
    public Configuration getConfiguration() {
        return configuration;
    }

    public List<Diagnostic> getDiagnostics() {
        return configuration != null ? configuration.getDiagnostics() : List.of();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (fileName != null) {
            sb.append("File '").append(fileName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }

    private static int firstLine(Configuration configuration) {
        if (configuration == null || configuration.getDiagnostics().isEmpty()) {
            return -1;
        }
        int line = configuration.getDiagnostics().get(0).getLineNumber();
        return line > 0 ? line : -1;
    }

    private static String summarise(Configuration configuration) {
        if (configuration == null || configuration.getDiagnostics().isEmpty()) {
            return "Workflow file is invalid";
        }
        List<Diagnostic> diagnostics = configuration.getDiagnostics();
        String first = diagnostics.get(0).getMessage();
        if (diagnostics.size() == 1) {
            return first;
        }
        return first + " (and " + (diagnostics.size() - 1) + " more)";
    }
}
