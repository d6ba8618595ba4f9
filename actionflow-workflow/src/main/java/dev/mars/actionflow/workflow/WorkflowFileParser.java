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

import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.hcl.ObjectList;
import dev.mars.actionflow.model.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Parses and validates workflow files into a {@link Configuration}.
 *
 * <p>Every method either returns a configuration whose diagnostics are all below the
 * failure threshold, or throws a {@link WorkflowParseException} carrying the partial
 * configuration and the complete diagnostic list.
 */
public interface WorkflowFileParser {

    Configuration parse(Path workflowFile) throws WorkflowParseException;

    Configuration parseFromString(String content) throws WorkflowParseException;

    /**
     * Parses an already-read syntax tree.
     */
    Configuration parse(ObjectList root) throws WorkflowParseException;

    /**
     * Reports every diagnostic for the content, sorted by line, regardless of the failure threshold.
     * A syntax error is reported as a single fatal diagnostic.
     *
     * @param content the workflow file content
     * @return diagnostics, empty for a clean file
     */
    List<Diagnostic> validate(String content);

    DependencyGraph buildDependencyGraph(Configuration configuration);
}
