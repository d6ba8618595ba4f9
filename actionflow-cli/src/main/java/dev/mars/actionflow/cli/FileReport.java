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

import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.model.Configuration;

import java.util.List;

/**
 * Outcome of checking one workflow file.
 *
 * @param file        the path as given on the command line
 * @param valid       whether the file parsed below the failure threshold
 * @param actions     number of actions found, including those of an invalid file
 * @param workflows   number of workflows found, including those of an invalid file
 * @param diagnostics every diagnostic, sorted by line
 * @param ioError     why the file could not be read, or null
 */
record FileReport(String file, boolean valid, int actions, int workflows,
                  List<Diagnostic> diagnostics, String ioError) {

    FileReport {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    static FileReport valid(String file, Configuration configuration) {
        return new FileReport(file, true, configuration.getActions().size(),
                configuration.getWorkflows().size(), configuration.getDiagnostics(), null);
    }

    static FileReport invalid(String file, Configuration configuration) {
        return new FileReport(file, false, configuration.getActions().size(),
                configuration.getWorkflows().size(), configuration.getDiagnostics(), null);
    }

    static FileReport unreadable(String file, String reason) {
        return new FileReport(file, false, 0, 0, List.of(), reason);
    }

    boolean isUnreadable() {
        return ioError != null;
    }
}
