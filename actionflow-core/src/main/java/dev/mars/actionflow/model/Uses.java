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

import java.util.Objects;

/**
 * Tagged value for the {@code uses} attribute of an action. It takes one of three forms:
 * <ul>
 *   <li>{@link InRepo} - {@code "./path"}</li>
 *   <li>{@link CrossRepo} - {@code "owner/repo/path@ref"}, with the {@code /path} part optional</li>
 *   <li>{@link DockerImage} - {@code "docker://image"}</li>
 * </ul>
 * Anything else is {@link Unrecognized}, which always comes with an error diagnostic.
 * Every variant keeps the string it was parsed from, available through {@link #raw()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 2.0
 * @since 2025-08-18
 */
public sealed interface Uses permits Uses.InRepo, Uses.CrossRepo, Uses.DockerImage, Uses.Unrecognized {

    String IN_REPO_PREFIX = "./";
    String DOCKER_PREFIX = "docker://";

    /**
     * The original attribute value.
     */
    String raw();

    UsesForm form();

    /**
     * Value carried by an action that never declared {@code uses}.
     */
    static Uses missing() {
        return new Unrecognized("");
    }

    /**
     * @param path the full value, including the leading {@code ./}
     */
    record InRepo(String path) implements Uses {
        public InRepo {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String raw() {
            return path;
        }

        @Override
        public UsesForm form() {
            return UsesForm.IN_REPO;
        }

        @Override
        public String toString() {
            return path;
        }
    }

    /**
     * @param repository {@code owner/repo}
     * @param path       {@code /subpath}, or {@code /} when no subpath was given
     * @param ref        the part after the last {@code @}
     * @param raw        the original value
     */
    record CrossRepo(String repository, String path, String ref, String raw) implements Uses {
        public CrossRepo {
            Objects.requireNonNull(repository, "repository");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(ref, "ref");
            Objects.requireNonNull(raw, "raw");
        }

        /**
         * Builds the canonical value for a repository reference.
         *
         * @param subpath path inside the repository without a leading slash; null or empty for none
         */
        public static CrossRepo of(String repository, String subpath, String ref) {
            boolean hasSubpath = subpath != null && !subpath.isEmpty();
            String raw = repository + (hasSubpath ? "/" + subpath : "") + "@" + ref;
            return new CrossRepo(repository, hasSubpath ? "/" + subpath : "/", ref, raw);
        }

        @Override
        public UsesForm form() {
            return UsesForm.CROSS_REPO;
        }

        @Override
        public String toString() {
            return raw;
        }
    }

    /**
     * @param image everything after {@code docker://}
     */
    record DockerImage(String image) implements Uses {
        public DockerImage {
            Objects.requireNonNull(image, "image");
        }

        @Override
        public String raw() {
            return DOCKER_PREFIX + image;
        }

        @Override
        public UsesForm form() {
            return UsesForm.DOCKER_IMAGE;
        }

        @Override
        public String toString() {
            return raw();
        }
    }

    record Unrecognized(String raw) implements Uses {
        public Unrecognized {
            raw = raw != null ? raw : "";
        }

        @Override
        public UsesForm form() {
            return UsesForm.UNKNOWN;
        }

        @Override
        public String toString() {
            return raw;
        }
    }
}
