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

import dev.mars.actionflow.model.Uses;

/**
 * Classifies and decomposes the value of an action's {@code uses} attribute.
 *
 * <ul>
 *   <li>{@code ./path} is {@link Uses.InRepo}, keeping the leading {@code ./}</li>
 *   <li>{@code docker://image} is {@link Uses.DockerImage}</li>
 *   <li>{@code owner/repo[/subpath]@ref} is {@link Uses.CrossRepo}, split at the last {@code @};
 *       an absent or empty subpath gives the path {@code /}</li>
 *   <li>anything else is {@link Uses.Unrecognized}</li>
 * </ul>
 *
 * Parsing is pure: {@code parse(parse(s).raw())} equals {@code parse(s)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class UsesParser {

    private UsesParser() {
    }

    public static Uses parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Uses.missing();
        }
        if (raw.startsWith(Uses.IN_REPO_PREFIX)) {
            return new Uses.InRepo(raw);
        }
        if (raw.startsWith(Uses.DOCKER_PREFIX)) {
            return new Uses.DockerImage(raw.substring(Uses.DOCKER_PREFIX.length()));
        }

        int at = raw.lastIndexOf('@');
        if (at < 0) {
            return new Uses.Unrecognized(raw);
        }
        String ref = raw.substring(at + 1);
        String[] parts = raw.substring(0, at).split("/", 3);
        if (parts.length < 2) {
            return new Uses.Unrecognized(raw);
        }

        String repository = parts[0] + "/" + parts[1];
        String path = parts.length == 3 ? "/" + parts[2] : "/";
        return new Uses.CrossRepo(repository, path, ref, raw);
    }
}
