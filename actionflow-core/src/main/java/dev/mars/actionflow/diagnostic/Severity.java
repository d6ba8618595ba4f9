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

package dev.mars.actionflow.diagnostic;

import java.util.Locale;

/**
 * Severity of a diagnostic reported while parsing a workflow file.
 * Declaration order is significant: later constants are more severe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum Severity {

    /**
     * A mistake that might affect correctness. The file is still runnable.
     */
    WARNING,

    /**
     * A mistake that prevents execution of any workflow in the file.
     * The file can still be displayed.
     */
    ERROR,

    /**
     * A mistake that prevents even drawing the file: a syntax failure or a dependency cycle.
     */
    FATAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a severity name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known severity
     */
    public static Severity fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Severity cannot be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
