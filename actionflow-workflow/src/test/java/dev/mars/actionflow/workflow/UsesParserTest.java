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
import dev.mars.actionflow.model.UsesForm;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link UsesParser}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-19
 */
class UsesParserTest {

    @Test
    void testInRepoKeepsPrefix() {
        assertEquals(new Uses.InRepo("./tools/lint"), UsesParser.parse("./tools/lint"));
        assertEquals(new Uses.InRepo("./"), UsesParser.parse("./"));
    }

    @Test
    void testDockerImage() {
        assertEquals(new Uses.DockerImage("alpine:3.19"), UsesParser.parse("docker://alpine:3.19"));
    }

    @ParameterizedTest
    @CsvSource({
            "foo/bar@dev,            foo/bar, /,           dev",
            "foo/bar/path@1.0.0,     foo/bar, /path,       1.0.0",
            "foo/bar/a/b/c@v2,       foo/bar, /a/b/c,      v2",
            "foo/bar/@dev,           foo/bar, /,           dev",
            "foo/bar@user@example,   foo/bar@user, /,      example",
    })
    void testCrossRepo(String raw, String repository, String path, String ref) {
        Uses.CrossRepo uses = assertInstanceOf(Uses.CrossRepo.class, UsesParser.parse(raw));

        assertEquals(repository, uses.repository());
        assertEquals(path, uses.path());
        assertEquals(ref, uses.ref());
        assertEquals(raw, uses.raw());
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo", "foo/bar", "foo@bar", "docker:/alpine", ".foo"})
    void testUnrecognized(String raw) {
        Uses uses = UsesParser.parse(raw);

        assertEquals(new Uses.Unrecognized(raw), uses);
        assertEquals(UsesForm.UNKNOWN, uses.form());
    }

    @Test
    void testMissing() {
        assertEquals(Uses.missing(), UsesParser.parse(""));
        assertEquals(Uses.missing(), UsesParser.parse(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"./x", "docker://alpine", "foo/bar@dev", "foo/bar/p@v", "foo"})
    void testReparsingRawIsStable(String raw) {
        Uses first = UsesParser.parse(raw);

        assertEquals(first, UsesParser.parse(first.raw()));
    }
}
