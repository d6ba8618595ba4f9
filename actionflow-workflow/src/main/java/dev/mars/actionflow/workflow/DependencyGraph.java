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

import dev.mars.actionflow.model.Action;
import dev.mars.actionflow.model.Configuration;
import dev.mars.actionflow.model.Workflow;

import java.util.*;

/**
 * Represents the dependency graph induced by the {@code needs} lists of a file's actions.
 * Provides methods for elementary cycle enumeration and for ordering actions so that
 * every action comes after the actions it needs.
 *
 * <p>Vertices are the actions in file order; an edge runs from an action to each action it needs.
 * Dependency names that match no action are left out of the graph. When an identifier is
 * declared twice, edges point at the later declaration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DependencyGraph {

    private final List<Action> actions;
    private final Map<String, Integer> indexByName;
    private final List<List<Integer>> dependencies;
    private final List<List<Integer>> dependents;

    public DependencyGraph(List<Action> actions) {
        this.actions = List.copyOf(Objects.requireNonNull(actions, "Actions cannot be null"));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.actions.size(); i++) {
            indexByName.put(this.actions.get(i).getIdentifier(), i);
        }

        this.dependencies = new ArrayList<>(this.actions.size());
        this.dependents = new ArrayList<>(this.actions.size());
        for (int i = 0; i < this.actions.size(); i++) {
            dependencies.add(new ArrayList<>());
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < this.actions.size(); i++) {
            Set<Integer> targets = new LinkedHashSet<>();
            for (String need : this.actions.get(i).getNeeds()) {
                Integer target = indexByName.get(need);
                if (target != null) {
                    targets.add(target);
                }
            }
            for (int target : targets) {
                dependencies.get(i).add(target);
                dependents.get(target).add(i);
            }
        }
    }

    public static DependencyGraph of(Configuration configuration) {
        return new DependencyGraph(configuration.getActions());
    }

    /**
     * Gets all actions in the graph, in file order.
     */
    public List<Action> getActions() {
        return actions;
    }

    /**
     * Gets the names of the declared actions the given action needs, in declaration order.
     *
     * @param actionName the name of the action
     * @return dependency names, empty for an unknown action
     */
    public List<String> getDependencies(String actionName) {
        Integer index = indexByName.get(actionName);
        if (index == null) {
            return List.of();
        }
        return dependencies.get(index).stream()
                .map(i -> actions.get(i).getIdentifier())
                .toList();
    }

    /**
     * Enumerates every elementary cycle exactly once using Johnson's algorithm.
     *
     * <p>Each cycle starts at its lowest-indexed action. Cycles are ordered by the index of their
     * last action (the one whose {@code needs} closes the cycle), then by their first action,
     * then by the remaining path, so that equal input always produces equal output.
     *
     * @return the cycles, a self-dependency being a cycle of one action
     */
    public List<Cycle> findElementaryCycles() {
        List<List<Integer>> found = new ArrayList<>();
        for (int start = 0; start < actions.size(); start++) {
            Set<Integer> component = componentOf(start);
            if (component.size() == 1 && !dependencies.get(start).contains(start)) {
                continue;
            }
            new CircuitSearch(start, component, found).circuit(start);
        }

        found.sort(Comparator.<List<Integer>>comparingInt(c -> c.get(c.size() - 1))
                .thenComparingInt(c -> c.get(0))
                .thenComparing(DependencyGraph::compareLexicographically));

        List<Cycle> cycles = new ArrayList<>(found.size());
        for (List<Integer> indices : found) {
            List<String> names = indices.stream().map(i -> actions.get(i).getIdentifier()).toList();
            cycles.add(new Cycle(indices, names));
        }
        return cycles;
    }

    /**
     * Detects circular dependencies in the graph.
     *
     * @return true if at least one cycle exists
     */
    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (WorkflowParseException e) {
            return true;
        }
    }

    /**
     * Orders all actions so that each follows the actions it needs.
     * Among actions that are ready at the same time, file order wins.
     *
     * @throws WorkflowParseException if circular dependencies are detected
     */
    public List<Action> topologicalSort() throws WorkflowParseException {
        Set<Integer> all = new LinkedHashSet<>();
        for (int i = 0; i < actions.size(); i++) {
            all.add(i);
        }
        return sort(all);
    }

    /**
     * Gets the actions needed to resolve a workflow: its goals and everything they need,
     * transitively, in an order where dependencies come first.
     *
     * @throws WorkflowParseException if a goal is not a declared action or the actions involved form a cycle
     */
    public List<Action> resolveOrder(Workflow workflow) throws WorkflowParseException {
        return resolveOrder(workflow.getResolves());
    }

    /**
     * Gets the given goal actions and everything they need, transitively, dependencies first.
     *
     * @throws WorkflowParseException if a goal is not a declared action or the actions involved form a cycle
     */
    public List<Action> resolveOrder(Collection<String> goals) throws WorkflowParseException {
        Set<Integer> closure = new HashSet<>();
        Deque<Integer> pending = new ArrayDeque<>();
        for (String goal : goals) {
            Integer index = indexByName.get(goal);
            if (index == null) {
                throw new WorkflowParseException("Cannot resolve unknown action '" + goal + "'");
            }
            pending.push(index);
        }
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (closure.add(current)) {
                dependencies.get(current).forEach(pending::push);
            }
        }
        return sort(closure);
    }

    private List<Action> sort(Set<Integer> nodes) throws WorkflowParseException {
        // Kahn's algorithm, lowest index first
        Map<Integer, Integer> inDegree = new HashMap<>();
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int node : nodes) {
            int degree = (int) dependencies.get(node).stream().filter(nodes::contains).count();
            inDegree.put(node, degree);
            if (degree == 0) {
                ready.offer(node);
            }
        }

        List<Action> result = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            int current = ready.poll();
            result.add(actions.get(current));
            for (int dependent : dependents.get(current)) {
                if (!nodes.contains(dependent)) {
                    continue;
                }
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.offer(dependent);
                }
            }
        }

        if (result.size() != nodes.size()) {
            List<String> remaining = new ArrayList<>();
            for (int node : new TreeSet<>(nodes)) {
                if (inDegree.get(node) > 0) {
                    remaining.add(actions.get(node).getIdentifier());
                }
            }
            throw new WorkflowParseException("Circular dependency detected among actions: " + remaining);
        }
        return result;
    }

    /**
     * The strongly connected component containing {@code start} within the subgraph of
     * vertices whose index is at least {@code start}.
     */
    private Set<Integer> componentOf(int start) {
        Set<Integer> forward = reachable(start, dependencies);
        Set<Integer> backward = reachable(start, dependents);
        forward.retainAll(backward);
        return forward;
    }

    private Set<Integer> reachable(int start, List<List<Integer>> edges) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (!seen.add(current)) {
                continue;
            }
            for (int next : edges.get(current)) {
                if (next >= start && !seen.contains(next)) {
                    pending.push(next);
                }
            }
        }
        return seen;
    }

    private static int compareLexicographically(List<Integer> a, List<Integer> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = Integer.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * Johnson's CIRCUIT procedure for one start vertex.
     */
    private final class CircuitSearch {
        private final int start;
        private final Set<Integer> component;
        private final List<List<Integer>> found;
        private final boolean[] blocked;
        private final List<Set<Integer>> blockedBy;
        private final List<Integer> path = new ArrayList<>();

        CircuitSearch(int start, Set<Integer> component, List<List<Integer>> found) {
            this.start = start;
            this.component = component;
            this.found = found;
            this.blocked = new boolean[actions.size()];
            this.blockedBy = new ArrayList<>(actions.size());
            for (int i = 0; i < actions.size(); i++) {
                blockedBy.add(new HashSet<>());
            }
        }

        boolean circuit(int vertex) {
            boolean closed = false;
            path.add(vertex);
            blocked[vertex] = true;

            for (int next : dependencies.get(vertex)) {
                if (!component.contains(next)) {
                    continue;
                }
                if (next == start) {
                    found.add(List.copyOf(path));
                    closed = true;
                } else if (!blocked[next] && circuit(next)) {
                    closed = true;
                }
            }

            if (closed) {
                unblock(vertex);
            } else {
                for (int next : dependencies.get(vertex)) {
                    if (component.contains(next)) {
                        blockedBy.get(next).add(vertex);
                    }
                }
            }

            path.remove(path.size() - 1);
            return closed;
        }

        private void unblock(int vertex) {
            blocked[vertex] = false;
            List<Integer> waiting = new ArrayList<>(blockedBy.get(vertex));
            blockedBy.get(vertex).clear();
            for (int w : waiting) {
                if (blocked[w]) {
                    unblock(w);
                }
            }
        }
    }

    /**
     * One elementary cycle.
     *
     * @param indices positions of the actions in file order, starting at the lowest
     * @param actions the action names, in the same order
     */
    public record Cycle(List<Integer> indices, List<String> actions) {

        public Cycle {
            indices = List.copyOf(indices);
            actions = List.copyOf(actions);
        }

        public String start() {
            return actions.get(0);
        }

        public int startIndex() {
            return indices.get(0);
        }

        /**
         * Index of the action whose {@code needs} closes the cycle.
         */
        public int lastIndex() {
            return indices.get(indices.size() - 1);
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "actions=" + actions.size() +
               ", edges=" + dependencies.stream().mapToInt(List::size).sum() +
               '}';
    }
}
