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
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.model.EventTypes;

import java.util.Objects;

/**
 * Options controlling a single parse. Immutable; create through {@link #builder()}.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * ParserOptions options = ParserOptions.builder()
 *     .suppressWarnings()
 *     .fileName("main.workflow")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class ParserOptions {

    private static final ParserOptions DEFAULTS = builder().build();

    private final Severity failureThreshold;
    private final String fileName;
    private final EventTypes eventTypes;

    private ParserOptions(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.fileName = builder.fileName;
        this.eventTypes = builder.eventTypes;
    }

    /**
     * Any diagnostic fails the parse; no file name; default event types.
     */
    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maps the {@code actionflow.parser.*} settings onto options.
     */
    public static ParserOptions fromConfiguration(ActionflowConfiguration configuration) {
        return builder()
                .failureThreshold(configuration.getFailureThreshold())
                .eventTypes(configuration.getEventTypes())
                .build();
    }

    /**
     * The lowest severity that makes the parse fail.
     */
    public Severity getFailureThreshold() {
        return failureThreshold;
    }

    public String getFileName() {
        return fileName;
    }

    public EventTypes getEventTypes() {
        return eventTypes;
    }

    public boolean isFailure(Severity severity) {
        return severity.isAtLeast(failureThreshold);
    }

    public Builder toBuilder() {
        return builder()
                .failureThreshold(failureThreshold)
                .fileName(fileName)
                .eventTypes(eventTypes);
    }

    @Override
    public String toString() {
        return "ParserOptions{" +
               "failureThreshold=" + failureThreshold +
               ", fileName='" + fileName + '\'' +
               ", eventTypes=" + eventTypes.names().size() +
               '}';
    }

    public static class Builder {
        private Severity failureThreshold = Severity.WARNING;
        private String fileName = "";
        private EventTypes eventTypes = EventTypes.defaults();

        private Builder() {
        }

        public Builder failureThreshold(Severity failureThreshold) {
            this.failureThreshold = Objects.requireNonNull(failureThreshold, "Failure threshold cannot be null");
            return this;
        }

        /**
         * Warnings no longer fail the parse.
         */
        public Builder suppressWarnings() {
            return failureThreshold(Severity.ERROR);
        }

        /**
         * Only fatal diagnostics fail the parse.
         */
        public Builder suppressErrors() {
            return failureThreshold(Severity.FATAL);
        }

        /**
         * Name stamped on the position of every diagnostic.
         */
        public Builder fileName(String fileName) {
            this.fileName = fileName != null ? fileName : "";
            return this;
        }

        public Builder eventTypes(EventTypes eventTypes) {
            this.eventTypes = Objects.requireNonNull(eventTypes, "Event types cannot be null");
            return this;
        }

        public ParserOptions build() {
            return new ParserOptions(this);
        }
    }
}
