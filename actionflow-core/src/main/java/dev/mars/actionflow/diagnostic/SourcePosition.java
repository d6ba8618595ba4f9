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

/**
 * Location of a node in a workflow file. Lines and columns are 1-based;
 * zero means the location is unknown.
 *
 * @param file   the file name, or an empty string when parsing from memory
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record SourcePosition(String file, int line, int column) {

    private static final SourcePosition UNKNOWN = new SourcePosition("", 0, 0);

    public SourcePosition {
        file = file != null ? file : "";
    }

    public static SourcePosition unknown() {
        return UNKNOWN;
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition("", line, column);
    }

    public boolean isKnown() {
        return line > 0;
    }

    public SourcePosition withFile(String fileName) {
        return new SourcePosition(fileName, line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!file.isEmpty()) {
            sb.append(file).append(':');
        }
        sb.append(line).append(':').append(column);
        return sb.toString();
    }
}
