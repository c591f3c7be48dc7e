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

package org.fireflyframework.bpmn.core.graph;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.model.CallActivity;
import org.fireflyframework.bpmn.model.DataObject;
import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.FlowCondition;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.FlowTarget;
import org.fireflyframework.bpmn.model.Gateway;
import org.fireflyframework.bpmn.model.GatewayDirection;
import org.fireflyframework.bpmn.model.InlineGateway;
import org.fireflyframework.bpmn.model.Lane;
import org.fireflyframework.bpmn.model.Modifier;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.Notification;
import org.fireflyframework.bpmn.model.Operation;
import org.fireflyframework.bpmn.model.SequenceFlow;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.SubProcessType;
import org.fireflyframework.bpmn.model.Task;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Converts a declarative {@link WorkflowProcess} into a resolved {@link ProcessGraph}.
 *
 * <p>Building never aborts. Every duplicate id, dangling reference or
 * malformed branch set becomes a failure and the graph is completed on a
 * best-effort basis so later analyses still run. The builder itself is
 * stateless and thread-safe; each call works on its own assembly.
 *
 * <p>Passes, in order:
 * <ol>
 *   <li>register every element of every scope, attaching boundary events to their host</li>
 *   <li>link compensation boundary events to their handler activities</li>
 *   <li>expand each sequence-flow path into edges, scope by scope</li>
 *   <li>check default-branch placement on every branching point</li>
 * </ol>
 */
@Slf4j
public class GraphBuilder {

    public BuildResult build(WorkflowProcess process) {
        return build(process, id -> false);
    }

    /**
     * @param processExists tells whether a called process id exists in the
     *                      compilation scope; the built process itself always does
     */
    public BuildResult build(WorkflowProcess process, Predicate<NodeId> processExists) {
        Objects.requireNonNull(process, "process");
        Assembly assembly = new Assembly(process, processExists);
        assembly.run();
        ProcessGraph graph = new ProcessGraph(process.id(), assembly.scopes, assembly.nodes,
                assembly.edges, assembly.associations);
        log.debug("[bpmn-graph] Built process '{}': {} scopes, {} nodes, {} edges, {} build failures",
                process.id(), graph.scopes().size(), graph.nodeCount(), graph.edgeCount(), assembly.failures.size());
        return new BuildResult(graph, assembly.failures);
    }

    private record PendingBody(int scope, SubProcess subProcess) {
    }

    private record PendingHandler(int boundary, int scope, NodeId handler) {
    }

    private static final class Assembly {
        private final WorkflowProcess process;
        private final Predicate<NodeId> processExists;

        private final List<Scope> scopes = new ArrayList<>();
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<Association> associations = new ArrayList<>();
        private final List<WorkflowFailure> failures = new ArrayList<>();

        private final List<Map<String, Integer>> names = new ArrayList<>();
        private final List<List<SequenceFlow>> flows = new ArrayList<>();
        private final List<PendingHandler> pendingHandlers = new ArrayList<>();
        private final Set<Integer> boundaryWithIncoming = new HashSet<>();
        private int syntheticCounter;

        Assembly(WorkflowProcess process, Predicate<NodeId> processExists) {
            this.process = process;
            this.processExists = processExists != null ? processExists : id -> false;
        }

        void run() {
            int root = addScope(process.id(), ScopeKind.PROCESS, -1, -1, null, "");
            register(process.elements(), root, null);
            resolveCompensationHandlers();
            for (int s = 0; s < scopes.size(); s++) {
                for (SequenceFlow flow : flows.get(s)) {
                    expand(flow.path(), List.of(), null, s, scopes.get(s).qualify(flow.id()));
                }
            }
            checkDefaultBranches();
        }

        // ── Registration ───────────────────────────────────────────

        private int addScope(NodeId id, ScopeKind kind, int parent, int owner,
                             SubProcessType type, String prefix) {
            int index = scopes.size();
            scopes.add(new Scope(index, id, kind, parent, owner, type, prefix));
            names.add(new HashMap<>());
            flows.add(new ArrayList<>());
            return index;
        }

        private int addNode(int scope, NodeId name, NodeKind kind, FlowElement element,
                            int attachedTo, int bodyScope, NodeId lane, boolean synthetic) {
            Scope s = scopes.get(scope);
            Map<String, Integer> table = names.get(scope);
            if (table.containsKey(name.value())) {
                failures.add(new WorkflowFailure.DuplicateNodeId(s.qualify(name), s.id()));
                return -1;
            }
            int index = nodes.size();
            nodes.add(new GraphNode(index, s.qualify(name), name, kind, scope, element,
                    attachedTo, bodyScope, lane, synthetic));
            table.put(name.value(), index);
            return index;
        }

        private void register(List<FlowElement> elements, int scope, NodeId lane) {
            List<PendingBody> bodies = new ArrayList<>();
            for (FlowElement element : elements) {
                if (element instanceof Lane l) {
                    addNode(scope, l.id(), NodeKind.LANE, l, -1, -1, lane, false);
                    register(l.elements(), scope, l.id());
                } else if (element instanceof SequenceFlow flow) {
                    flows.get(scope).add(flow);
                } else if (element instanceof Task task) {
                    int idx = addNode(scope, task.id(), NodeKind.TASK, task, -1, -1, lane, false);
                    registerBoundaryEvents(task.boundaryEvents(), idx, scope, lane);
                } else if (element instanceof SubProcess sub) {
                    int body = scopes.size();
                    int idx = addNode(scope, sub.id(), NodeKind.SUBPROCESS, sub, -1, body, lane, false);
                    if (idx >= 0) {
                        NodeId qualified = nodes.get(idx).id();
                        addScope(qualified, ScopeKind.SUBPROCESS, scope, idx, sub.type(), qualified.value());
                        bodies.add(new PendingBody(body, sub));
                    }
                    registerBoundaryEvents(sub.boundaryEvents(), idx, scope, lane);
                } else if (element instanceof CallActivity call) {
                    int idx = addNode(scope, call.id(), NodeKind.CALL_ACTIVITY, call, -1, -1, lane, false);
                    if (idx >= 0 && !call.calledElement().equals(process.id())
                            && !processExists.test(call.calledElement())) {
                        failures.add(new WorkflowFailure.CalledElementNotFound(nodes.get(idx).id(), call.calledElement()));
                    }
                    registerBoundaryEvents(call.boundaryEvents(), idx, scope, lane);
                } else if (element instanceof Gateway gateway) {
                    NodeKind kind = gateway.direction() == GatewayDirection.SPLIT
                            ? NodeKind.SPLIT_GATEWAY : NodeKind.MERGE_GATEWAY;
                    addNode(scope, gateway.id(), kind, gateway, -1, -1, lane, false);
                } else if (element instanceof Event event) {
                    addNode(scope, event.id(), eventKind(event), event, -1, -1, lane, false);
                } else if (element instanceof DataObject data) {
                    addNode(scope, data.id(), NodeKind.DATA_OBJECT, data, -1, -1, lane, false);
                } else if (element instanceof Notification notification) {
                    addNode(scope, notification.id(), NodeKind.NOTIFICATION, notification, -1, -1, lane, false);
                } else if (element instanceof Operation operation) {
                    addNode(scope, operation.id(), NodeKind.OPERATION, operation, -1, -1, lane, false);
                }
            }
            for (PendingBody body : bodies) {
                register(body.subProcess().elements(), body.scope(), null);
            }
        }

        private static NodeKind eventKind(Event event) {
            if (event.boundary()) {
                return NodeKind.BOUNDARY_EVENT;
            }
            return switch (event.role()) {
                case START -> NodeKind.START_EVENT;
                case END -> NodeKind.END_EVENT;
                case INTERMEDIATE -> NodeKind.INTERMEDIATE_EVENT;
            };
        }

        private void registerBoundaryEvents(List<Event> events, int host, int scope, NodeId lane) {
            if (host < 0) {
                return;
            }
            for (Event event : events) {
                int idx = addNode(scope, event.id(), NodeKind.BOUNDARY_EVENT, event, host, -1, lane, false);
                if (idx < 0) {
                    continue;
                }
                associations.add(new Association(AssociationKind.BOUNDARY_ATTACHMENT, host, idx));
                if (event.compensationHandler() != null) {
                    pendingHandlers.add(new PendingHandler(idx, scope, event.compensationHandler().handlerActivity()));
                }
            }
        }

        private void resolveCompensationHandlers() {
            for (PendingHandler pending : pendingHandlers) {
                Integer target = names.get(pending.scope()).get(pending.handler().value());
                if (target == null) {
                    failures.add(new WorkflowFailure.UnresolvedNodeReference(pending.handler(),
                            nodes.get(pending.boundary()).id()));
                } else {
                    associations.add(new Association(AssociationKind.COMPENSATION, pending.boundary(), target));
                }
            }
        }

        // ── Flow expansion ─────────────────────────────────────────

        /**
         * Expands one path starting from {@code predecessors} and returns the
         * tail nodes the path ends on. A block fans out from the current
         * predecessors, which act as its branch point, and its tails are the
         * union of the branch tails.
         */
        private List<Integer> expand(List<FlowTarget> path, List<Integer> predecessors,
                                     FlowCondition inherited, int scope, NodeId flowId) {
            List<Integer> current = predecessors;
            boolean first = true;
            for (FlowTarget step : path) {
                FlowCondition condition = step.condition() != null ? step.condition() : (first ? inherited : null);
                first = false;
                if (step.isElementRef()) {
                    int target = resolve(scope, step.elementRef(), flowId);
                    if (target < 0) {
                        current = List.of();
                        continue;
                    }
                    connect(current, target, condition, flowId);
                    current = List.of(target);
                } else if (step.isGateway()) {
                    int gateway = addSyntheticGateway(scope, step.inlineGateway());
                    connect(current, gateway, condition, flowId);
                    current = List.of(gateway);
                } else {
                    List<Integer> tails = new ArrayList<>();
                    for (SequenceFlow branch : step.block().branches()) {
                        if (branch.path().isEmpty()) {
                            continue;
                        }
                        for (int tail : expand(branch.path(), current, condition, scope, flowId)) {
                            if (!tails.contains(tail)) {
                                tails.add(tail);
                            }
                        }
                    }
                    current = tails;
                }
            }
            return current;
        }

        private int resolve(int scope, NodeId ref, NodeId flowId) {
            Integer idx = names.get(scope).get(ref.value());
            if (idx != null) {
                return idx;
            }
            if (declaredInRelatedScope(scope, ref)) {
                failures.add(new WorkflowFailure.SequenceFlowCrossesBoundary(ref, flowId));
            } else {
                failures.add(new WorkflowFailure.UnresolvedNodeReference(ref, flowId));
            }
            return -1;
        }

        private boolean declaredInRelatedScope(int scope, NodeId ref) {
            for (Scope other : scopes) {
                if (other.index() != scope
                        && (isAncestor(other.index(), scope) || isAncestor(scope, other.index()))
                        && names.get(other.index()).containsKey(ref.value())) {
                    return true;
                }
            }
            return false;
        }

        private boolean isAncestor(int ancestor, int scope) {
            int p = scopes.get(scope).parent();
            while (p >= 0) {
                if (p == ancestor) {
                    return true;
                }
                p = scopes.get(p).parent();
            }
            return false;
        }

        private int addSyntheticGateway(int scope, InlineGateway inline) {
            NodeId name = new NodeId("#gw" + (++syntheticCounter));
            Gateway element = new Gateway(name, inline.direction(), inline.kind(), null, null, Modifier.NONE);
            NodeKind kind = inline.direction() == GatewayDirection.SPLIT ? NodeKind.SPLIT_GATEWAY : NodeKind.MERGE_GATEWAY;
            return addNode(scope, name, kind, element, -1, -1, null, true);
        }

        private void connect(List<Integer> sources, int target, FlowCondition condition, NodeId flowId) {
            if (sources.isEmpty()) {
                return;
            }
            GraphNode node = nodes.get(target);
            if (node.kind() == NodeKind.BOUNDARY_EVENT) {
                if (boundaryWithIncoming.add(target)) {
                    failures.add(new WorkflowFailure.BoundaryEventHasIncomingFlow(node.id()));
                }
                return;
            }
            for (int source : sources) {
                edges.add(new Edge(edges.size(), source, target, condition, flowId));
            }
        }

        // ── Branch sets ────────────────────────────────────────────

        private void checkDefaultBranches() {
            List<List<Edge>> outgoing = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                outgoing.add(new ArrayList<>());
            }
            edges.forEach(e -> outgoing.get(e.source()).add(e));
            for (GraphNode node : nodes) {
                List<Edge> out = outgoing.get(node.index());
                long defaults = out.stream().filter(Edge::isDefault).count();
                if (defaults > 1) {
                    failures.add(new WorkflowFailure.MultipleDefaultBranches(node.id()));
                } else if (defaults == 1 && !out.get(out.size() - 1).isDefault()) {
                    failures.add(new WorkflowFailure.DefaultBranchNotLast(node.id()));
                }
            }
        }
    }
}
