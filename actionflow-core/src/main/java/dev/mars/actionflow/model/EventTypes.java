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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Allow-list of event type names a workflow may be triggered by. Matching is case-insensitive.
 *
 * <p>Instances are immutable; {@link #withAdded} and {@link #withRemoved} return new registries,
 * so a parse can be given a customised list without affecting any other caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class EventTypes {

    private static final Set<String> DEFAULT_EVENT_TYPES = Set.of(
        "check_run",
        "check_suite",
        "commit_comment",
        "create",
        "delete",
        "deployment",
        "deployment_status",
        "fork",
        "gollum",
        "issue_comment",
        "issues",
        "label",
        "member",
        "milestone",
        "page_build",
        "project",
        "project_card",
        "project_column",
        "public",
        "pull_request",
        "pull_request_review",
        "pull_request_review_comment",
        "push",
        "release",
        "repository_dispatch",
        "status",
        "watch"
    );

    private static final EventTypes DEFAULTS = new EventTypes(DEFAULT_EVENT_TYPES);

    private final Set<String> allowed;

    private EventTypes(Collection<String> names) {
        Set<String> normalized = new TreeSet<>();
        for (String name : names) {
            normalized.add(normalize(name));
        }
        this.allowed = Collections.unmodifiableSet(normalized);
    }

    public static EventTypes defaults() {
        return DEFAULTS;
    }

    public static EventTypes of(String... names) {
        return new EventTypes(Arrays.asList(names));
    }

    public boolean isAllowed(String eventType) {
        return eventType != null && allowed.contains(normalize(eventType));
    }

    public EventTypes withAdded(Collection<String> names) {
        Set<String> copy = new TreeSet<>(allowed);
        names.stream().map(String::trim).map(EventTypes::normalize).filter(n -> !n.isEmpty()).forEach(copy::add);
        return new EventTypes(copy);
    }

    public EventTypes withRemoved(Collection<String> names) {
        Set<String> copy = new TreeSet<>(allowed);
        names.stream().map(String::trim).map(EventTypes::normalize).forEach(copy::remove);
        return new EventTypes(copy);
    }

    public Set<String> names() {
        return allowed;
    }

    /**
     * Whether a workflow's {@code on} value matches the type of an incoming event.
     * Event types delivered by webhooks are lower-case; {@code on} values may be in any case.
     */
    public static boolean isMatching(String on, String eventType) {
        return on != null && eventType != null && normalize(on).equals(normalize(eventType));
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return allowed.equals(((EventTypes) o).allowed);
    }

    @Override
    public int hashCode() {
        return allowed.hashCode();
    }

    @Override
    public String toString() {
        return "EventTypes" + allowed;
    }
}
