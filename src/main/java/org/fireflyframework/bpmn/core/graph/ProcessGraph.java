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

import org.fireflyframework.bpmn.model.EventDirection;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, index-addressed process graph. Nodes, edges and scopes live in
 * flat lists; adjacency is computed once at construction so the graph can be
 * shared read-only between analysis workers.
 */
public final class ProcessGraph {

    private final NodeId processId;
    private final List<Scope> scopes;
    private final List<GraphNode> nodes;
    private final List<Edge> edges;
    private final List<Association> associations;

    private final List<List<Edge>> outgoing;
    private final List<List<Edge>> incoming;
    private final List<List<Integer>> nodesByScope;
    private final List<List<Integer>> childScopes;
    private final List<Map<String, Integer>> nameIndex;
    private final Map<String, Integer> qualifiedIndex;

    ProcessGraph(NodeId processId, List<Scope> scopes, List<GraphNode> nodes,
                 List<Edge> edges, List<Association> associations) {
        this.processId = processId;
        this.scopes = List.copyOf(scopes);
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.associations = List.copyOf(associations);

        List<List<Edge>> out = new ArrayList<>();
        List<List<Edge>> in = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        for (Edge e : edges) {
            out.get(e.source()).add(e);
            in.get(e.target()).add(e);
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);

        List<List<Integer>> byScope = new ArrayList<>();
        List<List<Integer>> children = new ArrayList<>();
        List<Map<String, Integer>> names = new ArrayList<>();
        for (int i = 0; i < scopes.size(); i++) {
            byScope.add(new ArrayList<>());
            children.add(new ArrayList<>());
            names.add(new HashMap<>());
        }
        for (Scope s : scopes) {
            if (!s.isRoot()) {
                children.get(s.parent()).add(s.index());
            }
        }
        Map<String, Integer> qualified = new HashMap<>();
        for (GraphNode n : nodes) {
            byScope.get(n.scope()).add(n.index());
            names.get(n.scope()).putIfAbsent(n.name().value(), n.index());
            qualified.putIfAbsent(n.id().value(), n.index());
        }
        this.nodesByScope = freeze(byScope);
        this.childScopes = freeze(children);
        this.nameIndex = names.stream().map(Collections::unmodifiableMap).toList();
        this.qualifiedIndex = Collections.unmodifiableMap(qualified);
    }

    private static <T> List<List<T>> freeze(List<List<T>> lists) {
        return lists.stream().map(List::copyOf).toList();
    }

    public NodeId processId() {
        return processId;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public Scope scope(int index) {
        return scopes.get(index);
    }

    public Scope rootScope() {
        return scopes.get(0);
    }

    public List<Integer> childScopes(int scope) {
        return childScopes.get(scope);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Association> associations() {
        return associations;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Node indices declared in the given scope, in declaration order. */
    public List<Integer> nodesIn(int scope) {
        return nodesByScope.get(scope);
    }

    public List<Edge> outgoing(int node) {
        return outgoing.get(node);
    }

    public List<Edge> incoming(int node) {
        return incoming.get(node);
    }

    public int outDegree(int node) {
        return outgoing.get(node).size();
    }

    public int inDegree(int node) {
        return incoming.get(node).size();
    }

    public List<Integer> successors(int node) {
        return outgoing.get(node).stream().map(Edge::target).toList();
    }

    public List<Integer> predecessors(int node) {
        return incoming.get(node).stream().map(Edge::source).toList();
    }

    public List<Association> associationsFrom(int node) {
        return associations.stream().filter(a -> a.source() == node).toList();
    }

    /** Boundary events attached to the given host activity. */
    public List<Integer> boundaryEventsOf(int host) {
        return associations.stream()
                .filter(a -> a.kind() == AssociationKind.BOUNDARY_ATTACHMENT && a.source() == host)
                .map(Association::target)
                .toList();
    }

    public Optional<GraphNode> find(int scope, NodeId name) {
        Integer idx = nameIndex.get(scope).get(name.value());
        return idx != null ? Optional.of(nodes.get(idx)) : Optional.empty();
    }

    /** Looks a node up by its scope-qualified id, e.g. {@code Sub.Task}. */
    public Optional<GraphNode> findByQualifiedId(String qualifiedId) {
        Integer idx = qualifiedIndex.get(qualifiedId);
        return idx != null ? Optional.of(nodes.get(idx)) : Optional.empty();
    }

    /**
     * An event subprocess is either flagged as triggered by an event, or has no
     * sequence flows and a body whose start event catches a trigger.
     */
    public boolean isEventSubProcess(int node) {
        GraphNode n = nodes.get(node);
        if (!(n.element() instanceof SubProcess sub)) {
            return false;
        }
        if (sub.triggeredByEvent()) {
            return true;
        }
        if (inDegree(node) > 0 || outDegree(node) > 0 || n.bodyScope() < 0) {
            return false;
        }
        return nodesIn(n.bodyScope()).stream()
                .map(nodes::get)
                .filter(GraphNode::isStartEvent)
                .flatMap(s -> s.event().stream())
                .anyMatch(e -> e.trigger() != null && e.direction() != EventDirection.THROW);
    }

    /** Activities marked for compensation or linked as a compensation handler. */
    public boolean isCompensationActivity(int node) {
        FlowElement element = nodes.get(node).element();
        boolean marked = (element instanceof Task t && t.forCompensation())
                || (element instanceof SubProcess sp && sp.forCompensation());
        return marked || associations.stream()
                .anyMatch(a -> a.kind() == AssociationKind.COMPENSATION && a.target() == node);
    }

    @Override
    public String toString() {
        return "ProcessGraph[" + processId + ", scopes=" + scopes.size()
                + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
