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

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.Edge;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.NodeKind;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.graph.Scope;
import org.fireflyframework.bpmn.core.topology.GraphTopology;
import org.fireflyframework.bpmn.model.EventTrigger;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.NodeId;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Whole-graph soundness checks, run scope by scope over flow nodes.
 *
 * <p>Within one scope failures are reported in a fixed order: dead nodes,
 * disconnected components, infinite loops, lack of synchronisation, sync
 * deadlocks and finally the roll-up {@code ProcessNotSound}. Dead-node,
 * component and roll-up checks need a start event and are skipped for scopes
 * without one and for ad-hoc bodies, whose activities run in any order.
 */
@Slf4j
public class SoundnessAnalyzer {

    private final boolean reportProcessNotSound;

    public SoundnessAnalyzer() {
        this(true);
    }

    public SoundnessAnalyzer(boolean reportProcessNotSound) {
        this.reportProcessNotSound = reportProcessNotSound;
    }

    public List<WorkflowFailure> analyze(ProcessGraph graph) {
        List<WorkflowFailure> failures = new ArrayList<>();
        for (Scope scope : graph.scopes()) {
            failures.addAll(analyzeScope(graph, scope.index()));
        }
        return failures;
    }

    public List<WorkflowFailure> analyzeScope(ProcessGraph graph, int scopeIndex) {
        Scope scope = graph.scope(scopeIndex);
        List<Integer> members = graph.nodesIn(scopeIndex).stream()
                .filter(i -> graph.node(i).isFlowNode())
                .toList();
        Set<Integer> memberSet = new LinkedHashSet<>(members);
        List<Integer> starts = members.stream().filter(i -> graph.node(i).isStartEvent()).toList();
        boolean rooted = !starts.isEmpty() && !scope.isAdHoc();

        List<WorkflowFailure> failures = new ArrayList<>();
        Set<Integer> reached = Set.of();
        if (rooted) {
            List<Integer> roots = new ArrayList<>(starts);
            members.stream()
                    .filter(i -> graph.isEventSubProcess(i) || graph.isCompensationActivity(i))
                    .forEach(roots::add);
            reached = GraphTopology.reachableFrom(graph, roots, memberSet, true);
            deadNodes(graph, members, reached, failures);
            disconnectedComponents(graph, members, new HashSet<>(roots), failures);
        }

        Set<Integer> loopMembers = new HashSet<>();
        infiniteLoops(graph, members, loopMembers, failures);
        GatewayPairing.Loops loops = GatewayPairing.Loops.of(graph, memberSet);
        Set<Integer> lackOfSync = lackOfSync(graph, members, memberSet, loops, failures);
        syncDeadlocks(graph, members, memberSet, loops, lackOfSync, failures);

        if (rooted && reportProcessNotSound) {
            notSound(graph, scope, members, memberSet, reached, loopMembers).ifPresent(failures::add);
        }
        if (!failures.isEmpty()) {
            log.debug("[bpmn-soundness] Scope '{}': {} soundness failure(s)", scope.id(), failures.size());
        }
        return failures;
    }

    // ── Reachability ───────────────────────────────────────────

    private void deadNodes(ProcessGraph graph, List<Integer> members, Set<Integer> reached,
                           List<WorkflowFailure> failures) {
        for (int m : members) {
            if (!reached.contains(m)) {
                failures.add(new WorkflowFailure.DeadNode(graph.node(m).id()));
            }
        }
    }

    /**
     * Components of two or more nodes that contain no root. A single isolated
     * node is left out: its dead-node failure already describes it, and
     * reporting it twice would turn one unreachable task into two failures.
     */
    private void disconnectedComponents(ProcessGraph graph, List<Integer> members, Set<Integer> roots,
                                        List<WorkflowFailure> failures) {
        for (List<Integer> component : GraphTopology.weakComponents(graph, members)) {
            if (component.size() >= 2 && component.stream().noneMatch(roots::contains)) {
                failures.add(new WorkflowFailure.DisconnectedComponent(ids(graph, component)));
            }
        }
    }

    // ── Cycles ─────────────────────────────────────────────────

    private void infiniteLoops(ProcessGraph graph, List<Integer> members, Set<Integer> loopMembers,
                               List<WorkflowFailure> failures) {
        for (List<Integer> scc : GraphTopology.stronglyConnectedComponents(graph, members)) {
            if (!GraphTopology.isCycle(graph, scc)) {
                continue;
            }
            Set<Integer> inside = new HashSet<>(scc);
            if (hasExit(graph, scc, inside)) {
                continue;
            }
            List<Integer> cycle = GraphTopology.shortestCycle(graph, scc.get(0), inside);
            loopMembers.addAll(scc);
            failures.add(new WorkflowFailure.InfiniteLoop(ids(graph, cycle)));
        }
    }

    /**
     * A cycle can be left when an edge leaving it is a choice (it starts at a
     * split gateway or carries a condition) or when one of its activities
     * has a boundary event.
     */
    private static boolean hasExit(ProcessGraph graph, List<Integer> scc, Set<Integer> inside) {
        for (int u : scc) {
            if (!graph.boundaryEventsOf(u).isEmpty()) {
                return true;
            }
            boolean split = graph.node(u).kind() == NodeKind.SPLIT_GATEWAY;
            for (Edge e : graph.outgoing(u)) {
                if (!inside.contains(e.target()) && graph.node(e.target()).isFlowNode()
                        && (split || e.condition() != null)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ── Synchronisation ────────────────────────────────────────

    private Set<Integer> lackOfSync(ProcessGraph graph, List<Integer> members, Set<Integer> memberSet,
                                    GatewayPairing.Loops loops, List<WorkflowFailure> failures) {
        Set<Integer> reported = new LinkedHashSet<>();
        for (int m : members) {
            if (!graph.node(m).isGatewayOf(NodeKind.SPLIT_GATEWAY, GatewayKind.PARALLEL)) {
                continue;
            }
            GatewayPairing.closure(graph, m, memberSet, loops)
                    .filter(c -> graph.node(c).isGatewayOf(NodeKind.MERGE_GATEWAY, GatewayKind.EXCLUSIVE))
                    .filter(reported::add)
                    .ifPresent(c -> failures.add(new WorkflowFailure.LackOfSync(graph.node(c).id())));
        }
        return reported;
    }

    /**
     * A parallel merge deadlocks when the branches feeding it come from a
     * conditional branch point, or when one of its inputs is only produced
     * behind a conditional branch point while the others come from a parallel
     * split. Merges already reported as lack of synchronisation are skipped.
     * The exit split of a loop is not a conditional origin: the token it
     * releases always arrives once the loop is left.
     */
    private void syncDeadlocks(ProcessGraph graph, List<Integer> members, Set<Integer> memberSet,
                               GatewayPairing.Loops loops, Set<Integer> lackOfSync,
                               List<WorkflowFailure> failures) {
        for (int m : members) {
            GraphNode merge = graph.node(m);
            if (!merge.isGatewayOf(NodeKind.MERGE_GATEWAY, GatewayKind.PARALLEL)
                    || graph.inDegree(m) < 2 || lackOfSync.contains(m)) {
                continue;
            }
            List<Set<Integer>> originsPerEdge = graph.incoming(m).stream()
                    .filter(e -> memberSet.contains(e.source()))
                    .map(e -> GatewayPairing.origins(graph, e, memberSet, loops))
                    .toList();
            if (deadlocks(graph, originsPerEdge)) {
                failures.add(new WorkflowFailure.SyncDeadlock(merge.id()));
            }
        }
    }

    private static boolean deadlocks(ProcessGraph graph, List<Set<Integer>> originsPerEdge) {
        Map<Integer, Integer> coverage = new HashMap<>();
        originsPerEdge.forEach(origins -> origins.forEach(o -> coverage.merge(o, 1, Integer::sum)));
        Optional<Integer> common = coverage.entrySet().stream()
                .filter(e -> e.getValue() >= 2)
                .map(Map.Entry::getKey)
                .min(Comparator.<Integer>comparingInt(coverage::get).reversed()
                        .thenComparingInt(Integer::intValue));

        if (common.isPresent() && GatewayPairing.branchKind(graph, common.get()).isConditional()) {
            return true;
        }
        return originsPerEdge.stream()
                .filter(origins -> common.isEmpty() || !origins.contains(common.get()))
                .flatMap(Set::stream)
                .anyMatch(o -> GatewayPairing.branchKind(graph, o).isConditional());
    }

    // ── Roll-up ────────────────────────────────────────────────

    private Optional<WorkflowFailure> notSound(ProcessGraph graph, Scope scope, List<Integer> members,
                                               Set<Integer> memberSet, Set<Integer> reached,
                                               Set<Integer> loopMembers) {
        List<Integer> ends = members.stream().filter(i -> graph.node(i).isEndEvent()).toList();
        if (ends.stream().noneMatch(reached::contains)) {
            return Optional.of(new WorkflowFailure.ProcessNotSound(
                    "no end event of \"" + scope.id() + "\" is reachable from its start events."));
        }
        Set<Integer> completing = GraphTopology.reaching(graph, ends, memberSet);
        List<Integer> stuck = reached.stream()
                .filter(i -> !completing.contains(i))
                .filter(i -> !loopMembers.contains(i))
                .filter(i -> !graph.isCompensationActivity(i) && !graph.isEventSubProcess(i))
                .filter(i -> !isCompensationBoundary(graph.node(i)))
                .sorted()
                .toList();
        if (stuck.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new WorkflowFailure.ProcessNotSound("nodes "
                + String.join(", ", GraphTopology.ids(graph, stuck)) + " of \"" + scope.id()
                + "\" are reachable but can never reach an end event."));
    }

    private static boolean isCompensationBoundary(GraphNode node) {
        return node.kind() == NodeKind.BOUNDARY_EVENT
                && node.event().map(e -> e.trigger() instanceof EventTrigger.Compensate).orElse(false);
    }

    private static List<NodeId> ids(ProcessGraph graph, List<Integer> indices) {
        return indices.stream().map(i -> graph.node(i).id()).toList();
    }
}
