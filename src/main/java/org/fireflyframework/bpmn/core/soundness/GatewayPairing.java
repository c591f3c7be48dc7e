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

package org.fireflyframework.bpmn.core.soundness;

import org.fireflyframework.bpmn.core.graph.Edge;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.NodeKind;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.topology.GraphTopology;
import org.fireflyframework.bpmn.model.GatewayKind;

import java.util.*;

/**
 * Structural matching of branch points with join points.
 *
 * <p>A branch point is a split gateway or any other flow node with two or
 * more outgoing edges; a join point is a merge gateway or any other flow node
 * with two or more incoming edges. Walks count nesting depth: crossing a
 * branch point opens a block, crossing a join point closes one. A join met at
 * depth zero belongs to the block being analysed.
 *
 * <p>The entry merge and the exit split of a loop do not open or close a
 * block: a token entering the loop always leaves it through its exit, so
 * both are walked through like plain activities.
 */
public final class GatewayPairing {

    private GatewayPairing() {}

    public static boolean isBranchPoint(ProcessGraph graph, int node) {
        GraphNode n = graph.node(node);
        if (n.kind() == NodeKind.SPLIT_GATEWAY) {
            return true;
        }
        return n.isFlowNode() && !n.kind().isGateway() && graph.outDegree(node) >= 2;
    }

    public static boolean isJoinPoint(ProcessGraph graph, int node) {
        GraphNode n = graph.node(node);
        if (n.kind() == NodeKind.MERGE_GATEWAY) {
            return true;
        }
        return n.isFlowNode() && !n.kind().isGateway() && graph.inDegree(node) >= 2;
    }

    /**
     * Kind of choice made at a branch point. An implicit branch point forks
     * in parallel unless one of its edges carries a condition.
     */
    public static GatewayKind branchKind(ProcessGraph graph, int node) {
        GraphNode n = graph.node(node);
        if (n.kind() == NodeKind.SPLIT_GATEWAY && n.gatewayKind() != null) {
            return n.gatewayKind();
        }
        boolean guarded = graph.outgoing(node).stream().anyMatch(e -> e.condition() != null);
        return guarded ? GatewayKind.EXCLUSIVE : GatewayKind.PARALLEL;
    }

    /** Implicit joins pass each token through, which is exclusive-merge semantics. */
    public static GatewayKind joinKind(ProcessGraph graph, int node) {
        GraphNode n = graph.node(node);
        if (n.kind() == NodeKind.MERGE_GATEWAY && n.gatewayKind() != null) {
            return n.gatewayKind();
        }
        return GatewayKind.EXCLUSIVE;
    }

    /**
     * Closure point of a branch point: the depth-zero join reached by the
     * most branches (at least two), ties broken by total distance and then by
     * node index.
     */
    public static Optional<Integer> closure(ProcessGraph graph, int split, Set<Integer> members) {
        return closure(graph, split, members, Loops.of(graph, members));
    }

    public static Optional<Integer> closure(ProcessGraph graph, int split, Set<Integer> members, Loops loops) {
        List<Integer> branches = graph.successors(split).stream().filter(members::contains).toList();
        return closureOf(graph, branches, split, members, loops);
    }

    /**
     * Closure of an arbitrary set of branch entry nodes, used when the
     * branches are not direct successors of one node.
     */
    public static Optional<Integer> closureOf(ProcessGraph graph, List<Integer> branchStarts,
                                              int origin, Set<Integer> members) {
        return closureOf(graph, branchStarts, origin, members, Loops.of(graph, members));
    }

    public static Optional<Integer> closureOf(ProcessGraph graph, List<Integer> branchStarts,
                                              int origin, Set<Integer> members, Loops loops) {
        Map<Integer, Integer> hits = new HashMap<>();
        Map<Integer, Integer> distance = new HashMap<>();
        for (int start : branchStarts) {
            firstJoins(graph, start, origin, members, loops).forEach((join, d) -> {
                hits.merge(join, 1, Integer::sum);
                distance.merge(join, d, Integer::sum);
            });
        }
        return hits.entrySet().stream()
                .filter(e -> e.getValue() >= 2)
                .map(Map.Entry::getKey)
                .min(Comparator.<Integer>comparingInt(hits::get).reversed()
                        .thenComparingInt(distance::get)
                        .thenComparingInt(Integer::intValue));
    }

    /**
     * Joins reached at depth zero walking forward from {@code start}, with
     * their shortest distance. The walk stops at such a join and never
     * re-enters {@code origin}.
     */
    static Map<Integer, Integer> firstJoins(ProcessGraph graph, int start, int origin, Set<Integer> members,
                                            Loops loops) {
        Map<Integer, Integer> found = new LinkedHashMap<>();
        int cap = graph.nodeCount();
        Deque<int[]> queue = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        queue.add(new int[]{start, 0, 1});
        seen.add(state(start, 0));
        while (!queue.isEmpty()) {
            int[] current = queue.poll();
            int node = current[0];
            int depth = current[1];
            int dist = current[2];
            if (node == origin) {
                continue;
            }
            if (isJoinPoint(graph, node) && !loops.isEntry(graph, node)) {
                if (depth == 0) {
                    found.merge(node, dist, Math::min);
                    continue;
                }
                depth--;
            }
            if (isBranchPoint(graph, node) && !loops.isExit(graph, node)) {
                depth++;
            }
            if (depth > cap) {
                continue;
            }
            for (Edge e : graph.outgoing(node)) {
                int next = e.target();
                if (members.contains(next) && seen.add(state(next, depth))) {
                    queue.add(new int[]{next, depth, dist + 1});
                }
            }
        }
        return found;
    }

    /**
     * Branch points that produce the token travelling along {@code edge},
     * found walking backward at depth zero. Empty when the edge descends
     * directly from a start event without branching.
     */
    public static Set<Integer> origins(ProcessGraph graph, Edge edge, Set<Integer> members) {
        return origins(graph, edge, members, Loops.of(graph, members));
    }

    public static Set<Integer> origins(ProcessGraph graph, Edge edge, Set<Integer> members, Loops loops) {
        Set<Integer> found = new LinkedHashSet<>();
        int merge = edge.target();
        int cap = graph.nodeCount();
        Deque<int[]> queue = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        queue.add(new int[]{edge.source(), 0});
        seen.add(state(edge.source(), 0));
        while (!queue.isEmpty()) {
            int[] current = queue.poll();
            int node = current[0];
            int depth = current[1];
            if (node == merge) {
                continue;
            }
            if (isBranchPoint(graph, node) && !loops.isExit(graph, node)) {
                if (depth == 0) {
                    found.add(node);
                    continue;
                }
                depth--;
            }
            if (isJoinPoint(graph, node) && !loops.isEntry(graph, node)) {
                depth++;
            }
            if (depth > cap) {
                continue;
            }
            for (Edge e : graph.incoming(node)) {
                int previous = e.source();
                if (members.contains(previous) && seen.add(state(previous, depth))) {
                    queue.add(new int[]{previous, depth});
                }
            }
        }
        return found;
    }

    /**
     * Cycle membership of the flow nodes of one scope. A loop entry is a
     * non-parallel join inside a cycle with at most one incoming edge from
     * outside it; a loop exit is a conditional branch inside a cycle with at
     * most one outgoing edge leaving it.
     */
    public static final class Loops {

        private final Map<Integer, Integer> cycleOf;
        private final Set<Integer> members;

        private Loops(Map<Integer, Integer> cycleOf, Set<Integer> members) {
            this.cycleOf = cycleOf;
            this.members = members;
        }

        public static Loops of(ProcessGraph graph, Set<Integer> members) {
            Map<Integer, Integer> cycleOf = new HashMap<>();
            List<List<Integer>> sccs = GraphTopology.stronglyConnectedComponents(graph, new ArrayList<>(members));
            for (int i = 0; i < sccs.size(); i++) {
                if (GraphTopology.isCycle(graph, sccs.get(i))) {
                    for (int node : sccs.get(i)) {
                        cycleOf.put(node, i);
                    }
                }
            }
            return new Loops(cycleOf, members);
        }

        boolean isEntry(ProcessGraph graph, int node) {
            Integer cycle = cycleOf.get(node);
            if (cycle == null || joinKind(graph, node) == GatewayKind.PARALLEL) {
                return false;
            }
            long fromOutside = graph.incoming(node).stream()
                    .map(Edge::source)
                    .filter(members::contains)
                    .filter(s -> !cycle.equals(cycleOf.get(s)))
                    .count();
            return fromOutside <= 1;
        }

        boolean isExit(ProcessGraph graph, int node) {
            Integer cycle = cycleOf.get(node);
            if (cycle == null || !branchKind(graph, node).isConditional()) {
                return false;
            }
            long leaving = graph.outgoing(node).stream()
                    .map(Edge::target)
                    .filter(members::contains)
                    .filter(t -> !cycle.equals(cycleOf.get(t)))
                    .count();
            return leaving <= 1;
        }
    }

    private static long state(int node, int depth) {
        return ((long) node << 32) | (depth & 0xffffffffL);
    }
}
