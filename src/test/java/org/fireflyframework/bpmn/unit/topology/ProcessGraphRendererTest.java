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


package org.fireflyframework.bpmn.unit.topology;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.topology.ProcessGraphRenderer;
import org.fireflyframework.bpmn.model.FlowBlock;
import org.fireflyframework.bpmn.model.FlowCondition;
import org.fireflyframework.bpmn.model.FlowTarget;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SequenceFlow;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProcessGraphRendererTest {

    private ProcessGraph graph;

    @BeforeEach
    void setUp() {
        graph = new GraphBuilder().build(ProcessBuilder.process("Order")
                .start("S").split("G", GatewayKind.EXCLUSIVE).task("Ship").end("E").task("Idle")
                .subProcess("Pay").start("PS").task("Charge").end("PE").flow("PS", "Charge", "PE").add()
                .flow(FlowTarget.element("S"), FlowTarget.element("G"), FlowTarget.block(new FlowBlock(List.of(
                        SequenceFlow.of("b1", FlowTarget.element("Pay", FlowCondition.expression("unpaid")),
                                FlowTarget.element("Ship")),
                        SequenceFlow.of("b2", FlowTarget.element("Ship", FlowCondition.otherwise()))))),
                        FlowTarget.element("E"))
                .build()).graph();
    }

    @Test
    void toDot_rendersNodesEdgesAndClusters() {
        String dot = ProcessGraphRenderer.toDot(graph, List.of());

        assertThat(dot).startsWith("digraph \"Order\" {");
        assertThat(dot).contains("\"S\" [label=\"S\", shape=circle];");
        assertThat(dot).contains("\"G\" [label=\"G (xor)\", shape=diamond];");
        assertThat(dot).contains("\"E\" [label=\"E\", shape=doublecircle];");
        assertThat(dot).contains("subgraph \"cluster_Pay\" {");
        assertThat(dot).contains("\"Pay.PS\" -> \"Pay.Charge\";");
        assertThat(dot).contains("\"G\" -> \"Pay\" [label=\"[unpaid]\"];");
        assertThat(dot).contains("\"G\" -> \"Ship\" [label=\"[_]\"];");
        assertThat(dot).doesNotContain("penwidth");
        assertThat(dot).endsWith("}\n");
    }

    @Test
    void toDot_highlightsFailingNodes() {
        String dot = ProcessGraphRenderer.toDot(graph, List.of(new WorkflowFailure.DeadNode(NodeId.of("Idle"))));

        assertThat(dot).contains("\"Idle\" [label=\"Idle\", shape=box, color=red, penwidth=2];");
    }

    @Test
    void toMermaid_rendersShapesLabelsAndStyles() {
        String mermaid = ProcessGraphRenderer.toMermaid(graph,
                List.of(new WorkflowFailure.DeadNode(NodeId.of("Idle"))));

        assertThat(mermaid).startsWith("graph LR\n");
        assertThat(mermaid).contains("S((\"S\"))");
        assertThat(mermaid).contains("G{\"G (xor)\"}");
        assertThat(mermaid).contains("Pay_Charge[\"Charge\"]");
        assertThat(mermaid).contains("subgraph body_Pay[\"Pay\"]");
        assertThat(mermaid).contains("G -->|[unpaid]| Pay");
        assertThat(mermaid).contains("style Idle stroke:#f00,stroke-width:2px");
    }
}
