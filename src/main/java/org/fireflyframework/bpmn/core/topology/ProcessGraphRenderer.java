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

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.Association;
import org.fireflyframework.bpmn.core.graph.AssociationKind;
import org.fireflyframework.bpmn.core.graph.Edge;
import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.graph.Scope;
import org.fireflyframework.bpmn.model.NodeId;

import java.util.*;

/**
 * Generates Graphviz DOT and Mermaid diagram text for a built process graph.
 * Subprocess bodies are drawn as nested clusters; nodes named by a failure
 * are highlighted.
 *
 * <pre>{@code
 * BuildResult built = new GraphBuilder().build(process);
 * String dot = ProcessGraphRenderer.toDot(built.graph(), failures);
 * String mermaid = ProcessGraphRenderer.toMermaid(built.graph(), failures);
 * }</pre>
 */
public final class ProcessGraphRenderer {

    private ProcessGraphRenderer() {}

    public static String toDot(ProcessGraph graph, List<WorkflowFailure> failures) {
        Set<String> flagged = flaggedIds(failures);
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(graph.processId().value())).append("\" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  graph [fontname=Helvetica];\n");
        sb.append("  node  [fontname=Helvetica, shape=box, style=rounded];\n");
        sb.append("  edge  [fontname=Helvetica];\n\n");

        dotScope(graph, graph.rootScope(), flagged, sb, "  ");

        sb.append("\n");
        for (Edge e : graph.edges()) {
            sb.append("  ").append(dotId(graph.node(e.source()))).append(" -> ").append(dotId(graph.node(e.target())));
            if (e.condition() != null) {
                sb.append(" [label=\"").append(escape(e.condition().toString())).append("\"]");
            }
            sb.append(";\n");
        }
        for (Association a : graph.associations()) {
            sb.append("  ").append(dotId(graph.node(a.source()))).append(" -> ").append(dotId(graph.node(a.target())))
                    .append(a.kind() == AssociationKind.COMPENSATION
                            ? " [style=dashed, color=grey40, label=\"compensate\"];\n"
                            : " [style=dotted, arrowhead=none];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void dotScope(ProcessGraph graph, Scope scope, Set<String> flagged, StringBuilder sb, String indent) {
        for (int idx : graph.nodesIn(scope.index())) {
            GraphNode node = graph.node(idx);
            sb.append(indent).append(dotId(node)).append(" [label=\"").append(escape(label(node))).append("\"")
                    .append(", shape=").append(dotShape(node));
            if (flagged.contains(node.id().value())) {
                sb.append(", color=red, penwidth=2");
            }
            sb.append("];\n");
        }
        for (int child : graph.childScopes(scope.index())) {
            Scope body = graph.scope(child);
            sb.append(indent).append("subgraph \"cluster_").append(sanitize(body.id().value())).append("\" {\n");
            sb.append(indent).append("  label=\"").append(escape(body.id().value())).append("\";\n");
            dotScope(graph, body, flagged, sb, indent + "  ");
            sb.append(indent).append("}\n");
        }
    }

    public static String toMermaid(ProcessGraph graph, List<WorkflowFailure> failures) {
        Set<String> flagged = flaggedIds(failures);
        StringBuilder sb = new StringBuilder();
        sb.append("graph LR\n");
        sb.append("  subgraph ").append(mermaidId(graph.processId().value()))
                .append("[\"").append(graph.processId().value()).append("\"]\n");
        mermaidScope(graph, graph.rootScope(), sb, "    ");
        for (Edge e : graph.edges()) {
            sb.append("    ").append(mermaidId(graph.node(e.source()).id().value()));
            if (e.condition() != null) {
                sb.append(" -->|").append(e.condition().toString().replace("|", "/")).append("| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(mermaidId(graph.node(e.target()).id().value())).append("\n");
        }
        for (Association a : graph.associations()) {
            sb.append("    ").append(mermaidId(graph.node(a.source()).id().value())).append(" -.-> ")
                    .append(mermaidId(graph.node(a.target()).id().value())).append("\n");
        }
        sb.append("  end\n");
        for (String id : flagged) {
            if (graph.findByQualifiedId(id).isPresent()) {
                sb.append("  style ").append(mermaidId(id)).append(" stroke:#f00,stroke-width:2px\n");
            }
        }
        return sb.toString();
    }

    private static void mermaidScope(ProcessGraph graph, Scope scope, StringBuilder sb, String indent) {
        for (int idx : graph.nodesIn(scope.index())) {
            GraphNode node = graph.node(idx);
            String id = mermaidId(node.id().value());
            String text = label(node).replace("\"", "'");
            switch (node.kind()) {
                case START_EVENT, END_EVENT, INTERMEDIATE_EVENT, BOUNDARY_EVENT ->
                        sb.append(indent).append(id).append("((\"").append(text).append("\"))\n");
                case SPLIT_GATEWAY, MERGE_GATEWAY ->
                        sb.append(indent).append(id).append("{\"").append(text).append("\"}\n");
                default -> sb.append(indent).append(id).append("[\"").append(text).append("\"]\n");
            }
        }
        for (int child : graph.childScopes(scope.index())) {
            Scope body = graph.scope(child);
            sb.append(indent).append("subgraph ").append(mermaidId("body_" + body.id().value()))
                    .append("[\"").append(body.id().value()).append("\"]\n");
            mermaidScope(graph, body, sb, indent + "  ");
            sb.append(indent).append("end\n");
        }
    }

    private static Set<String> flaggedIds(List<WorkflowFailure> failures) {
        Set<String> ids = new LinkedHashSet<>();
        if (failures != null) {
            failures.forEach(f -> f.nodeIds().stream().map(NodeId::value).forEach(ids::add));
        }
        return ids;
    }

    private static String label(GraphNode node) {
        if (node.gatewayKind() == null) {
            return node.name().value();
        }
        String kind = "(" + node.gatewayKind().label() + ")";
        return node.synthetic() ? kind : node.name().value() + " " + kind;
    }

    private static String dotShape(GraphNode node) {
        return switch (node.kind()) {
            case START_EVENT, INTERMEDIATE_EVENT, BOUNDARY_EVENT -> "circle";
            case END_EVENT -> "doublecircle";
            case SPLIT_GATEWAY, MERGE_GATEWAY -> "diamond";
            case DATA_OBJECT, NOTIFICATION, OPERATION -> "note";
            case LANE -> "tab";
            default -> "box";
        };
    }

    private static String dotId(GraphNode node) {
        return "\"" + sanitize(node.id().value()) + "\"";
    }

    private static String mermaidId(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String sanitize(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
                    (c >= '0' && c <= '9') || c == '_' || c == ':' || c == '.') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
