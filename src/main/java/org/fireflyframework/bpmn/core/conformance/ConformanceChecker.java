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

package org.fireflyframework.bpmn.core.conformance;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.NodeKind;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.soundness.GatewayPairing;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.NodeId;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Checks a concrete process against a reference process through
 * incarnation links.
 *
 * <p>Every concrete task must incarnate a task of the reference model, and
 * the branches of every reference parallel split must not be closed by an
 * exclusive merge in the concrete model. Concrete models may add steps the
 * reference does not have; no further structural equivalence is required.
 */
@Slf4j
public class ConformanceChecker {

    private final IncarnationResolver resolver;

    public ConformanceChecker() {
        this(new IncarnationResolver());
    }

    public ConformanceChecker(IncarnationResolver resolver) {
        this.resolver = resolver;
    }

    public List<WorkflowFailure> check(ProcessGraph concrete, ProcessGraph reference) {
        return check(concrete, reference, resolver.resolve(concrete));
    }

    public List<WorkflowFailure> check(ProcessGraph concrete, ProcessGraph reference, IncarnationMap incarnations) {
        List<WorkflowFailure> failures = new ArrayList<>();
        checkIncarnations(concrete, reference, incarnations, failures);
        checkParallelClosures(concrete, reference, incarnations, failures);
        log.debug("[bpmn-conformance] '{}' against '{}': {} incarnation(s), {} failure(s)",
                concrete.processId(), reference.processId(), incarnations.size(), failures.size());
        return failures;
    }

    // ── Incarnation coverage ───────────────────────────────────

    private void checkIncarnations(ProcessGraph concrete, ProcessGraph reference, IncarnationMap incarnations,
                                   List<WorkflowFailure> failures) {
        Set<String> referenceTasks = new HashSet<>();
        for (GraphNode node : reference.nodes()) {
            if (node.kind() == NodeKind.TASK) {
                referenceTasks.add(node.name().value());
                referenceTasks.add(node.id().value());
            }
        }
        for (GraphNode node : concrete.nodes()) {
            if (node.kind() != NodeKind.TASK) {
                continue;
            }
            List<String> targets = incarnations.targetsOf(node.id());
            if (targets.isEmpty()) {
                failures.add(new WorkflowFailure.TaskNotIncarnated(node.id()));
            } else if (targets.stream().noneMatch(referenceTasks::contains)) {
                failures.add(new WorkflowFailure.TaskNotIncarnated(node.id(), targets.get(0)));
            }
        }
    }

    // ── Merge kinds at parallel closures ───────────────────────

    private void checkParallelClosures(ProcessGraph concrete, ProcessGraph reference, IncarnationMap incarnations,
                                       List<WorkflowFailure> failures) {
        Set<Integer> reported = new HashSet<>();
        for (GraphNode split : reference.nodes()) {
            if (!split.isGatewayOf(NodeKind.SPLIT_GATEWAY, GatewayKind.PARALLEL)) {
                continue;
            }
            Set<Integer> refMembers = flowMembers(reference, split.scope());
            Optional<Integer> refClosure = GatewayPairing.closure(reference, split.index(), refMembers);

            List<Integer> counterparts = new ArrayList<>();
            for (int branch : reference.successors(split.index())) {
                if (!refMembers.contains(branch)) continue;
                firstCounterpart(reference, concrete, incarnations, branch, split.index(),
                        refClosure.orElse(-1), refMembers).ifPresent(counterparts::add);
            }
            if (counterparts.size() < 2) {
                continue;
            }
            int concreteScope = concrete.node(counterparts.get(0)).scope();
            List<Integer> sameScope = counterparts.stream()
                    .filter(c -> concrete.node(c).scope() == concreteScope)
                    .distinct()
                    .toList();
            if (sameScope.size() < 2) {
                continue;
            }
            Optional<Integer> closure = GatewayPairing.closureOf(concrete, sameScope, -1,
                    flowMembers(concrete, concreteScope));
            if (closure.isPresent()
                    && concrete.node(closure.get()).isGatewayOf(NodeKind.MERGE_GATEWAY, GatewayKind.EXCLUSIVE)
                    && reported.add(closure.get())) {
                List<NodeId> path = new ArrayList<>();
                path.add(split.id());
                sameScope.forEach(c -> path.add(concrete.node(c).id()));
                path.add(concrete.node(closure.get()).id());
                failures.add(new WorkflowFailure.ParallelBranchesClosedWithXor(
                        concrete.node(closure.get()).id(), path));
            }
        }
    }

    /**
     * Walks one reference branch in breadth-first order up to the branch
     * closure and returns the concrete incarnation of the first reference
     * activity that has one.
     */
    private Optional<Integer> firstCounterpart(ProcessGraph reference, ProcessGraph concrete,
                                               IncarnationMap incarnations, int branch, int split,
                                               int closure, Set<Integer> members) {
        Deque<Integer> queue = new ArrayDeque<>();
        Set<Integer> seen = new HashSet<>();
        queue.add(branch);
        seen.add(branch);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            if (node == split || node == closure) {
                continue;
            }
            GraphNode ref = reference.node(node);
            if (ref.kind().isActivity()) {
                Optional<Integer> counterpart = incarnations.incarnationsOf(ref.name().value()).stream()
                        .map(id -> concrete.findByQualifiedId(id.value()))
                        .flatMap(Optional::stream)
                        .map(GraphNode::index)
                        .findFirst();
                if (counterpart.isPresent()) {
                    return counterpart;
                }
            }
            for (int next : reference.successors(node)) {
                if (members.contains(next) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    private static Set<Integer> flowMembers(ProcessGraph graph, int scope) {
        Set<Integer> members = new LinkedHashSet<>();
        for (int idx : graph.nodesIn(scope)) {
            if (graph.node(idx).isFlowNode()) {
                members.add(idx);
            }
        }
        return members;
    }
}
