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

package dev.mars.actionflow.model;

/**
 * Which addressing form an action's {@code uses} attribute takes.
 */
public enum UsesForm {
    /** Code in the same repository as the workflow file ({@code ./path}). */
    IN_REPO("in_repo"),
    /** Code in another repository ({@code owner/repo[/path]@ref}). */
    CROSS_REPO("cross_repo"),
    /** A container image ({@code docker://image}). */
    DOCKER_IMAGE("docker"),
    /** Missing or malformed value. */
    UNKNOWN("unknown");

    private final String label;

    UsesForm(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
