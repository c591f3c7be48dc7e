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

package org.fireflyframework.bpmn.core.validation;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.NodeKind;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.graph.Scope;
import org.fireflyframework.bpmn.model.CallActivity;
import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.EventDirection;
import org.fireflyframework.bpmn.model.EventTrigger;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.LoopCardinality;
import org.fireflyframework.bpmn.model.LoopCharacteristic;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.Task;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Local context conditions, checked node by node against the built graph.
 * Each rule reads one node and its direct edges only, so scopes can be
 * validated independently.
 */
@Slf4j
public class StructuralValidator {

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern NEGATIVE_INTEGER = Pattern.compile("-\\d+");
    private static final List<String> NON_NUMERIC_OPERATORS =
            List.of("==", "!=", "<", ">", "&&", "||", "!");

    public List<WorkflowFailure> validate(ProcessGraph graph) {
        List<WorkflowFailure> failures = new ArrayList<>();
        for (Scope scope : graph.scopes()) {
            failures.addAll(validateScope(graph, scope.index()));
        }
        return failures;
    }

    public List<WorkflowFailure> validateScope(ProcessGraph graph, int scopeIndex) {
        List<WorkflowFailure> failures = new ArrayList<>();
        boolean hasStart = false;
        boolean hasEnd = false;

        for (int idx : graph.nodesIn(scopeIndex)) {
            GraphNode node = graph.node(idx);
            switch (node.kind()) {
                case START_EVENT -> {
                    hasStart = true;
                    checkStartEvent(graph, node, failures);
                }
                case END_EVENT -> {
                    hasEnd = true;
                    checkEndEvent(graph, node, failures);
                }
                case BOUNDARY_EVENT -> checkBoundaryEvent(graph, node, failures);
                case INTERMEDIATE_EVENT -> checkCancelPlacement(graph, node, failures);
                case SPLIT_GATEWAY -> checkSplitGateway(graph, node, failures);
                case MERGE_GATEWAY -> checkMergeGateway(graph, node, failures);
                case TASK, CALL_ACTIVITY -> checkActivity(graph, node, failures);
                case SUBPROCESS -> {
                    checkSubProcess(graph, node, failures);
                    checkActivity(graph, node, failures);
                }
                default -> {
                    // data, notifications, operations and lanes carry no flow rules
                }
            }
        }

        if (hasStart && !hasEnd) {
            failures.add(new WorkflowFailure.NoEndEventWithStartEvent(graph.scope(scopeIndex).id()));
        }
        if (!failures.isEmpty()) {
            log.debug("[bpmn-validation] Scope '{}': {} structural failure(s)",
                    graph.scope(scopeIndex).id(), failures.size());
        }
        return failures;
    }

    // ── Events ─────────────────────────────────────────────────

    private void checkStartEvent(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        int in = graph.inDegree(node.index());
        if (in > 0) {
            failures.add(new WorkflowFailure.StartEventHasIncomingFlow(node.id(), in));
        }
        if (direction(node) == EventDirection.THROW) {
            failures.add(new WorkflowFailure.StartEventIsThrowing(node.id()));
        }
        checkCancelPlacement(graph, node, failures);
    }

    private void checkEndEvent(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        if (graph.outDegree(node.index()) > 0) {
            failures.add(new WorkflowFailure.EndEventHasOutgoingFlow(node.id()));
        }
        if (direction(node) == EventDirection.CATCH) {
            failures.add(new WorkflowFailure.EndEventIsCatching(node.id()));
        }
        checkCancelPlacement(graph, node, failures);
    }

    private void checkBoundaryEvent(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        if (graph.inDegree(node.index()) > 0) {
            failures.add(new WorkflowFailure.BoundaryEventHasIncomingFlow(node.id()));
        }
        checkCancelPlacement(graph, node, failures);
    }

    /**
     * Cancel events belong to transactions: a cancel boundary event must sit on
     * a transaction subprocess, any other cancel event must be nested in one.
     */
    private void checkCancelPlacement(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        boolean cancel = node.event()
                .map(Event::trigger)
                .map(t -> t.involves(EventTrigger.Cancel.class))
                .orElse(false);
        if (!cancel) {
            return;
        }
        boolean legal;
        if (node.kind() == NodeKind.BOUNDARY_EVENT && node.attachedTo() >= 0) {
            legal = graph.node(node.attachedTo()).element() instanceof SubProcess sub && sub.isTransaction();
        } else {
            legal = insideTransaction(graph, node.scope());
        }
        if (!legal) {
            failures.add(new WorkflowFailure.CancelEventOutsideTransaction(node.id()));
        }
    }

    private static boolean insideTransaction(ProcessGraph graph, int scopeIndex) {
        for (int s = scopeIndex; s >= 0; s = graph.scope(s).parent()) {
            if (graph.scope(s).isTransaction()) {
                return true;
            }
        }
        return false;
    }

    private static EventDirection direction(GraphNode node) {
        return node.event().map(Event::direction).orElse(EventDirection.UNSPECIFIED);
    }

    // ── Gateways ───────────────────────────────────────────────

    private void checkSplitGateway(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        int in = graph.inDegree(node.index());
        int out = graph.outDegree(node.index());
        if (out < 2 || in > 1) {
            failures.add(new WorkflowFailure.SplitGatewayTooFewOutgoingFlows(node.id(), out, in));
        }
        if (node.gatewayKind() != null && node.gatewayKind().isEventBased()) {
            checkEventGatewayTargets(graph, node, failures);
        }
    }

    private void checkMergeGateway(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        if (node.gatewayKind() != null && node.gatewayKind().isEventBased()) {
            failures.add(new WorkflowFailure.EventGatewayIsNotSplit(node.id()));
        }
        int in = graph.inDegree(node.index());
        int out = graph.outDegree(node.index());
        if (in < 2 || out > 1) {
            failures.add(new WorkflowFailure.MergeGatewayTooFewIncomingFlows(node.id(), in, out));
        }
    }

    /** Timer targets are neutral; message catch events and receive tasks must not be mixed. */
    private void checkEventGatewayTargets(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        boolean messageEvents = false;
        boolean receiveTasks = false;
        for (int target : graph.successors(node.index())) {
            GraphNode t = graph.node(target);
            if (t.kind() == NodeKind.INTERMEDIATE_EVENT && t.event().map(Event::isMessage).orElse(false)) {
                messageEvents = true;
            } else if (t.isReceiveTask()) {
                receiveTasks = true;
            }
        }
        if (messageEvents && receiveTasks) {
            failures.add(new WorkflowFailure.EventGatewayMixedTargetTypes(node.id()));
        }
    }

    // ── Activities ─────────────────────────────────────────────

    private void checkActivity(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        if (graph.isCompensationActivity(node.index())
                && (graph.inDegree(node.index()) > 0 || graph.outDegree(node.index()) > 0)) {
            failures.add(new WorkflowFailure.CompensationActivityHasFlow(node.id()));
        }
        LoopCharacteristic loop = loopOf(node.element());
        if (loop instanceof LoopCharacteristic.MultiInstanceLoop mi) {
            String offending = nonIntegerCount(mi.cardinality());
            if (offending != null) {
                failures.add(new WorkflowFailure.LoopCountNotInteger(node.id(), offending));
            }
        }
    }

    private void checkSubProcess(ProcessGraph graph, GraphNode node, List<WorkflowFailure> failures) {
        SubProcess sub = (SubProcess) node.element();
        List<GraphNode> body = node.bodyScope() >= 0
                ? graph.nodesIn(node.bodyScope()).stream().map(graph::node).toList()
                : List.of();

        if (sub.isAdHoc()) {
            if (body.stream().noneMatch(n -> n.kind().isActivity())) {
                failures.add(new WorkflowFailure.AdHocSubProcessEmpty(node.id()));
            }
            if (body.stream().anyMatch(n -> n.isStartEvent() || n.isEndEvent())) {
                failures.add(new WorkflowFailure.AdHocSubProcessHasStartOrEndEvent(node.id()));
            }
        }

        if (graph.isEventSubProcess(node.index())) {
            if (graph.inDegree(node.index()) > 0 || graph.outDegree(node.index()) > 0) {
                failures.add(new WorkflowFailure.EventSubProcessHasFlow(node.id()));
            }
            int starts = (int) body.stream().filter(GraphNode::isStartEvent).count();
            if (starts != 1) {
                failures.add(new WorkflowFailure.EventSubProcessStartEventCount(node.id(), starts));
            }
        }
    }

    private static LoopCharacteristic loopOf(FlowElement element) {
        if (element instanceof Task task) return task.loop();
        if (element instanceof SubProcess sub) return sub.loop();
        if (element instanceof CallActivity call) return call.loop();
        return null;
    }

    /**
     * Syntactic integer check on a loop cardinality. Returns the offending text,
     * or {@code null} when the count looks integer-valued. Collection counts
     * always qualify.
     */
    static String nonIntegerCount(LoopCardinality cardinality) {
        if (cardinality.literalCount() != null) {
            return cardinality.literalCount() < 0 ? String.valueOf(cardinality.literalCount()) : null;
        }
        if (cardinality.expression() == null) {
            return null;
        }
        String expr = cardinality.expression().trim();
        if (expr.isEmpty()
                || expr.startsWith("\"") || expr.startsWith("'")
                || expr.equals("true") || expr.equals("false")
                || DECIMAL.matcher(expr).matches()
                || NEGATIVE_INTEGER.matcher(expr).matches()
                || NON_NUMERIC_OPERATORS.stream().anyMatch(expr::contains)) {
            return cardinality.expression();
        }
        return null;
    }
}
