/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.bpmn.core.topology;

import org.fireflyframework.bpmn.core.graph.Association;
import org.fireflyframework.bpmn.core.graph.Edge;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;

import java.util.*;

/**
 * Graph algorithms over a {@link ProcessGraph}, restricted to a member set
 * (typically the flow nodes of one scope). All results are deterministic:
 * lists follow node index order unless stated otherwise.
 */
public final class GraphTopology {

    private GraphTopology() {}

    /**
     * Forward reachability over sequence-flow edges. When
     * {@code followAssociations} is set, boundary attachments and
     * compensation links are traversed as well.
     */
    public static Set<Integer> reachableFrom(ProcessGraph graph, Collection<Integer> roots,
                                             Set<Integer> members, boolean followAssociations) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int root : roots) {
            if (members.contains(root) && visited.add(root)) {
                queue.add(root);
            }
        }
        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (Edge e : graph.outgoing(u)) {
                if (members.contains(e.target()) && visited.add(e.target())) {
                    queue.add(e.target());
                }
            }
            if (followAssociations) {
                for (Association a : graph.associationsFrom(u)) {
                    if (members.contains(a.target()) && visited.add(a.target())) {
                        queue.add(a.target());
                    }
                }
            }
        }
        return visited;
    }

    /**
     * Backward reachability: every member that has a path to one of the
     * targets. A boundary event's host counts as a predecessor of the event.
     */
    public static Set<Integer> reaching(ProcessGraph graph, Collection<Integer> targets, Set<Integer> members) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int target : targets) {
            if (members.contains(target) && visited.add(target)) {
                queue.add(target);
            }
        }
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (Edge e : graph.incoming(v)) {
                if (members.contains(e.source()) && visited.add(e.source())) {
                    queue.add(e.source());
                }
            }
            int host = graph.node(v).attachedTo();
            if (host >= 0 && members.contains(host) && visited.add(host)) {
                queue.add(host);
            }
        }
        return visited;
    }

    /**
     * Weakly connected components over edges and associations. Components
     * are ordered by their lowest member index.
     */
    public static List<List<Integer>> weakComponents(ProcessGraph graph, List<Integer> members) {
        Set<Integer> memberSet = new HashSet<>(members);
        Map<Integer, List<Integer>> undirected = new HashMap<>();
        members.forEach(m -> undirected.put(m, new ArrayList<>()));
        for (Edge e : graph.edges()) {
            link(undirected, memberSet, e.source(), e.target());
        }
        for (Association a : graph.associations()) {
            link(undirected, memberSet, a.source(), a.target());
        }

        List<Integer> ordered = new ArrayList<>(members);
        Collections.sort(ordered);
        Set<Integer> seen = new HashSet<>();
        List<List<Integer>> components = new ArrayList<>();
        for (int start : ordered) {
            if (!seen.add(start)) continue;
            List<Integer> component = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                int u = stack.pop();
                component.add(u);
                for (int v : undirected.get(u)) {
                    if (seen.add(v)) {
                        stack.push(v);
                    }
                }
            }
            Collections.sort(component);
            components.add(component);
        }
        return components;
    }

    private static void link(Map<Integer, List<Integer>> undirected, Set<Integer> members, int a, int b) {
        if (members.contains(a) && members.contains(b)) {
            undirected.get(a).add(b);
            undirected.get(b).add(a);
        }
    }

    /**
     * Tarjan's strongly connected components over sequence-flow edges between
     * members. Components are ordered by their lowest member index and each
     * component is sorted.
     */
    public static List<List<Integer>> stronglyConnectedComponents(ProcessGraph graph, List<Integer> members) {
        Tarjan tarjan = new Tarjan(graph, new HashSet<>(members));
        List<Integer> ordered = new ArrayList<>(members);
        Collections.sort(ordered);
        for (int v : ordered) {
            if (!tarjan.index.containsKey(v)) {
                tarjan.strongConnect(v);
            }
        }
        List<List<Integer>> result = new ArrayList<>(tarjan.components);
        result.forEach(Collections::sort);
        result.sort(Comparator.comparingInt(c -> c.get(0)));
        return result;
    }

    /** A component is a cycle when it has two or more members or a self-loop. */
    public static boolean isCycle(ProcessGraph graph, List<Integer> component) {
        if (component.size() > 1) {
            return true;
        }
        int only = component.get(0);
        return graph.outgoing(only).stream().anyMatch(e -> e.target() == only);
    }

    /**
     * Shortest cycle through {@code start} that stays inside {@code within},
     * as node indices with {@code start} repeated at the end. Empty when no
     * such cycle exists.
     */
    public static List<Integer> shortestCycle(ProcessGraph graph, int start, Set<Integer> within) {
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        Set<Integer> visited = new HashSet<>();
        visited.add(start);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (Edge e : graph.outgoing(u)) {
                int v = e.target();
                if (!within.contains(v)) continue;
                if (v == start) {
                    LinkedList<Integer> cycle = new LinkedList<>();
                    cycle.addFirst(start);
                    for (Integer w = u; w != null; w = parent.get(w)) {
                        cycle.addFirst(w);
                    }
                    return List.copyOf(cycle);
                }
                if (visited.add(v)) {
                    parent.put(v, u);
                    queue.add(v);
                }
            }
        }
        return List.of();
    }

    /** Renders node indices as their scope-qualified ids. */
    public static List<String> ids(ProcessGraph graph, Collection<Integer> indices) {
        return indices.stream().map(graph::node).map(GraphNode::id).map(Object::toString).toList();
    }

    private static final class Tarjan {
        private final ProcessGraph graph;
        private final Set<Integer> members;
        private final Map<Integer, Integer> index = new HashMap<>();
        private final Map<Integer, Integer> lowLink = new HashMap<>();
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final Set<Integer> onStack = new HashSet<>();
        private final List<List<Integer>> components = new ArrayList<>();
        private int counter;

        Tarjan(ProcessGraph graph, Set<Integer> members) {
            this.graph = graph;
            this.members = members;
        }

        /**
         * Iterative form of the classic recursion; each frame keeps the node
         * and the position of the next outgoing edge to visit.
         */
        void strongConnect(int root) {
            Deque<int[]> work = new ArrayDeque<>();
            visit(root);
            work.push(new int[]{root, 0});
            while (!work.isEmpty()) {
                int[] frame = work.peek();
                int v = frame[0];
                List<Edge> out = graph.outgoing(v);
                if (frame[1] < out.size()) {
                    int w = out.get(frame[1]++).target();
                    if (!members.contains(w)) continue;
                    if (!index.containsKey(w)) {
                        visit(w);
                        work.push(new int[]{w, 0});
                    } else if (onStack.contains(w)) {
                        lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                    }
                    continue;
                }
                work.pop();
                if (lowLink.get(v).equals(index.get(v))) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        component.add(w);
                    } while (w != v);
                    components.add(component);
                }
                if (!work.isEmpty()) {
                    int parent = work.peek()[0];
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(v)));
                }
            }
        }

        private void visit(int v) {
            index.put(v, counter);
            lowLink.put(v, counter);
            counter++;
            stack.push(v);
            onStack.add(v);
        }
    }
}
