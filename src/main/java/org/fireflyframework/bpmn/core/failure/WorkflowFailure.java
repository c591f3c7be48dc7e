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

package org.fireflyframework.bpmn.core.failure;

import org.fireflyframework.bpmn.model.NodeId;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One violated invariant of a process. Failures are values: analyses collect
 * and return them, they are never thrown.
 *
 * <p>Node ids are scope-qualified: an element {@code X} declared inside
 * subprocess {@code S} is reported as {@code S.X}.
 */
public sealed interface WorkflowFailure {

    FailureKind kind();

    String message();

    /** Ids of the constructs a source view should highlight. */
    List<NodeId> nodeIds();

    default FailureCategory category() {
        return kind().category();
    }

    /** One-line diagnostic: kind, message and offending node ids. */
    default String render() {
        List<NodeId> ids = nodeIds();
        String suffix = ids.isEmpty() ? "" : " [" + joinIds(ids, ", ") + "]";
        return kind() + ": " + message() + suffix;
    }

    private static String joinIds(List<NodeId> ids, String separator) {
        return ids.stream().map(NodeId::value).collect(Collectors.joining(separator));
    }

    // ── Structural ─────────────────────────────────────────────

    record StartEventIsThrowing(NodeId eventId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.START_EVENT_IS_THROWING; }
        public String message() { return "Start event \"" + eventId + "\" must be catching, not throwing."; }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record StartEventHasIncomingFlow(NodeId eventId, int found) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.START_EVENT_HAS_INCOMING_FLOW; }
        public String message() {
            return "Start event \"" + eventId + "\" has " + found + " incoming flow(s); none are allowed.";
        }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record EndEventIsCatching(NodeId eventId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.END_EVENT_IS_CATCHING; }
        public String message() { return "End event \"" + eventId + "\" must be throwing, not catching."; }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record EndEventHasOutgoingFlow(NodeId eventId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.END_EVENT_HAS_OUTGOING_FLOW; }
        public String message() { return "End event \"" + eventId + "\" must not have outgoing flows."; }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record NoEndEventWithStartEvent(NodeId scopeId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.NO_END_EVENT_WITH_START_EVENT; }
        public String message() {
            return "Scope \"" + scopeId + "\" declares a start event but no end event.";
        }
        public List<NodeId> nodeIds() { return List.of(scopeId); }
    }

    record BoundaryEventHasIncomingFlow(NodeId eventId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.BOUNDARY_EVENT_HAS_INCOMING_FLOW; }
        public String message() { return "Boundary event \"" + eventId + "\" must not have incoming flows."; }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record SplitGatewayTooFewOutgoingFlows(NodeId gatewayId, int found, int incoming) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.SPLIT_GATEWAY_TOO_FEW_OUTGOING_FLOWS; }
        public String message() {
            if (found < 2) {
                return "Split gateway \"" + gatewayId + "\" has " + found
                        + " outgoing flow(s); at least 2 are required.";
            }
            return "Split gateway \"" + gatewayId + "\" has " + incoming
                    + " incoming flows; at most 1 is allowed.";
        }
        public List<NodeId> nodeIds() { return List.of(gatewayId); }
    }

    record MergeGatewayTooFewIncomingFlows(NodeId gatewayId, int found, int outgoing) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.MERGE_GATEWAY_TOO_FEW_INCOMING_FLOWS; }
        public String message() {
            if (found < 2) {
                return "Merge gateway \"" + gatewayId + "\" has " + found
                        + " incoming flow(s); at least 2 are required.";
            }
            return "Merge gateway \"" + gatewayId + "\" has " + outgoing
                    + " outgoing flows; at most 1 is allowed.";
        }
        public List<NodeId> nodeIds() { return List.of(gatewayId); }
    }

    record EventGatewayIsNotSplit(NodeId gatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.EVENT_GATEWAY_IS_NOT_SPLIT; }
        public String message() { return "Event gateway \"" + gatewayId + "\" must be a split gateway."; }
        public List<NodeId> nodeIds() { return List.of(gatewayId); }
    }

    record EventGatewayMixedTargetTypes(NodeId gatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.EVENT_GATEWAY_MIXED_TARGET_TYPES; }
        public String message() {
            return "Event gateway \"" + gatewayId
                    + "\" must not mix message events and receive tasks on its outgoing flows.";
        }
        public List<NodeId> nodeIds() { return List.of(gatewayId); }
    }

    record AdHocSubProcessEmpty(NodeId subProcessId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.AD_HOC_SUB_PROCESS_EMPTY; }
        public String message() {
            return "Ad-hoc subprocess \"" + subProcessId + "\" must contain at least one activity.";
        }
        public List<NodeId> nodeIds() { return List.of(subProcessId); }
    }

    record AdHocSubProcessHasStartOrEndEvent(NodeId subProcessId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.AD_HOC_SUB_PROCESS_HAS_START_OR_END_EVENT; }
        public String message() {
            return "Ad-hoc subprocess \"" + subProcessId + "\" must not have start or end events.";
        }
        public List<NodeId> nodeIds() { return List.of(subProcessId); }
    }

    record EventSubProcessHasFlow(NodeId subProcessId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.EVENT_SUB_PROCESS_HAS_FLOW; }
        public String message() {
            return "Event subprocess \"" + subProcessId + "\" must not have incoming or outgoing sequence flows.";
        }
        public List<NodeId> nodeIds() { return List.of(subProcessId); }
    }

    record EventSubProcessStartEventCount(NodeId subProcessId, int found) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.EVENT_SUB_PROCESS_START_EVENT_COUNT; }
        public String message() {
            return "Event subprocess \"" + subProcessId + "\" has " + found + " start events; exactly 1 is required.";
        }
        public List<NodeId> nodeIds() { return List.of(subProcessId); }
    }

    record CompensationActivityHasFlow(NodeId activityId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.COMPENSATION_ACTIVITY_HAS_FLOW; }
        public String message() {
            return "Compensation activity \"" + activityId + "\" must not have incoming or outgoing sequence flows.";
        }
        public List<NodeId> nodeIds() { return List.of(activityId); }
    }

    record LoopCountNotInteger(NodeId activityId, String expression) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.LOOP_COUNT_NOT_INTEGER; }
        public String message() {
            return "Loop count expression \"" + expression + "\" on activity \"" + activityId
                    + "\" must evaluate to an integer.";
        }
        public List<NodeId> nodeIds() { return List.of(activityId); }
    }

    record CancelEventOutsideTransaction(NodeId eventId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.CANCEL_EVENT_OUTSIDE_TRANSACTION; }
        public String message() {
            return "Cancel event \"" + eventId + "\" is only allowed inside a transaction subprocess.";
        }
        public List<NodeId> nodeIds() { return List.of(eventId); }
    }

    record MultipleDefaultBranches(NodeId splitGatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.MULTIPLE_DEFAULT_BRANCHES; }
        public String message() {
            return "Split gateway \"" + splitGatewayId + "\" has more than one default branch `[_]`.";
        }
        public List<NodeId> nodeIds() { return List.of(splitGatewayId); }
    }

    record DefaultBranchNotLast(NodeId gatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.DEFAULT_BRANCH_NOT_LAST; }
        public String message() {
            return "The default branch `[_]` at gateway \"" + gatewayId + "\" must be the last branch.";
        }
        public List<NodeId> nodeIds() { return List.of(gatewayId); }
    }

    // ── Reference ──────────────────────────────────────────────

    record UnresolvedNodeReference(NodeId referencedNode, NodeId fromFlow) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.UNRESOLVED_NODE_REFERENCE; }
        public String message() {
            return "Flow \"" + fromFlow + "\" references undefined node \"" + referencedNode + "\".";
        }
        public List<NodeId> nodeIds() { return List.of(fromFlow); }
    }

    record SequenceFlowCrossesBoundary(NodeId referencedNode, NodeId fromFlow) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.SEQUENCE_FLOW_CROSSES_BOUNDARY; }
        public String message() {
            return "Flow \"" + fromFlow + "\" references node \"" + referencedNode
                    + "\" across a subprocess boundary.";
        }
        public List<NodeId> nodeIds() { return List.of(fromFlow, referencedNode); }
    }

    record CalledElementNotFound(NodeId callActivityId, NodeId calledElement) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.CALLED_ELEMENT_NOT_FOUND; }
        public String message() {
            return "Call-activity \"" + callActivityId + "\" references process \"" + calledElement
                    + "\" which does not exist.";
        }
        public List<NodeId> nodeIds() { return List.of(callActivityId); }
    }

    record DuplicateNodeId(NodeId nodeId, NodeId scopeId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.DUPLICATE_NODE_ID; }
        public String message() {
            return "Node \"" + nodeId + "\" is declared more than once in scope \"" + scopeId + "\".";
        }
        public List<NodeId> nodeIds() { return List.of(nodeId); }
    }

    // ── Soundness ──────────────────────────────────────────────

    record DeadNode(NodeId nodeId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.DEAD_NODE; }
        public String message() {
            return "Node \"" + nodeId + "\" is unreachable (dead node); no path from a start event leads to it.";
        }
        public List<NodeId> nodeIds() { return List.of(nodeId); }
    }

    record DisconnectedComponent(List<NodeId> componentNodes) implements WorkflowFailure {
        public DisconnectedComponent {
            componentNodes = List.copyOf(componentNodes);
        }
        public FailureKind kind() { return FailureKind.DISCONNECTED_COMPONENT; }
        public String message() {
            return "The process contains a disconnected component with nodes: "
                    + joinIds(componentNodes, ", ") + ".";
        }
        public List<NodeId> nodeIds() { return componentNodes; }
    }

    record InfiniteLoop(List<NodeId> loopNodes) implements WorkflowFailure {
        public InfiniteLoop {
            loopNodes = List.copyOf(loopNodes);
        }
        public FailureKind kind() { return FailureKind.INFINITE_LOOP; }
        public String message() {
            return "The process contains an infinite loop through nodes: " + joinIds(loopNodes, " → ") + ".";
        }
        public List<NodeId> nodeIds() { return loopNodes; }
    }

    record LackOfSync(NodeId mergeGatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.LACK_OF_SYNC; }
        public String message() {
            return "Gateway \"" + mergeGatewayId
                    + "\": parallel branches merge at an XOR gateway (lack of synchronisation anti-pattern).";
        }
        public List<NodeId> nodeIds() { return List.of(mergeGatewayId); }
    }

    record SyncDeadlock(NodeId mergeGatewayId) implements WorkflowFailure {
        public FailureKind kind() { return FailureKind.SYNC_DEADLOCK; }
        public String message() {
            return "Gateway \"" + mergeGatewayId
                    + "\" will never receive all expected parallel tokens (sync deadlock).";
        }
        public List<NodeId> nodeIds() { return List.of(mergeGatewayId); }
    }

    record ProcessNotSound(String reason) implements WorkflowFailure {
        public ProcessNotSound {
            Objects.requireNonNull(reason, "reason");
        }
        public FailureKind kind() { return FailureKind.PROCESS_NOT_SOUND; }
        public String message() { return "The process is not sound: " + reason; }
        public List<NodeId> nodeIds() { return List.of(); }
    }

    // ── Conformance ────────────────────────────────────────────

    record TaskNotIncarnated(NodeId taskId, String declaredTarget) implements WorkflowFailure {
        public TaskNotIncarnated(NodeId taskId) {
            this(taskId, null);
        }
        public FailureKind kind() { return FailureKind.TASK_NOT_INCARNATED; }
        public String message() {
            if (declaredTarget != null) {
                return "Task \"" + taskId + "\" incarnates \"" + declaredTarget
                        + "\", which is not a task in the reference model.";
            }
            return "Task \"" + taskId + "\" does not incarnate any task in the reference model.";
        }
        public List<NodeId> nodeIds() { return List.of(taskId); }
    }

    record ParallelBranchesClosedWithXor(NodeId mergeGatewayId, List<NodeId> parallelBranch) implements WorkflowFailure {
        public ParallelBranchesClosedWithXor {
            parallelBranch = List.copyOf(parallelBranch);
        }
        public FailureKind kind() { return FailureKind.PARALLEL_BRANCHES_CLOSED_WITH_XOR; }
        public String message() {
            return "Merge gateway \"" + mergeGatewayId + "\" closes parallel branches with XOR (anti-pattern). "
                    + "Parallel path: " + joinIds(parallelBranch, " → ") + ".";
        }
        public List<NodeId> nodeIds() { return List.of(mergeGatewayId); }
    }
}
