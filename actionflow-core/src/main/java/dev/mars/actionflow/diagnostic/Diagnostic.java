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

import java.util.Objects;

/**
 * A single problem found in a workflow file, either syntactic or semantic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Diagnostic {

    private final Severity severity;
    private final SourcePosition position;
    private final String message;

    public Diagnostic(Severity severity, SourcePosition position, String message) {
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.position = position != null ? position : SourcePosition.unknown();
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    public static Diagnostic warning(SourcePosition position, String message) {
        return new Diagnostic(Severity.WARNING, position, message);
    }

    public static Diagnostic error(SourcePosition position, String message) {
        return new Diagnostic(Severity.ERROR, position, message);
    }

    public static Diagnostic fatal(SourcePosition position, String message) {
        return new Diagnostic(Severity.FATAL, position, message);
    }

    public Severity getSeverity() {
        return severity;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public int getLineNumber() {
        return position.line();
    }

    public String getMessage() {
        return message;
    }

    /**
     * Renders the diagnostic the way users see it: {@code Line 4: message},
     * or just the message when the position is unknown.
     */
    public String format() {
        if (position.isKnown()) {
            return "Line " + position.line() + ": " + message;
        }
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity &&
               Objects.equals(position, that.position) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, position, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name());

        if (position.isKnown()) {
            sb.append(" (line ").append(position.line()).append(")");
        }

        sb.append(": ").append(message);

        return sb.toString();
    }
}
