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

import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.topology.GraphTopology;
import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.EventTrigger;
import org.fireflyframework.bpmn.model.Task;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class GraphTopologyTest {

    private ProcessGraph graph;
    private List<Integer> members;
    private Set<Integer> memberSet;

    @BeforeEach
    void setUp() {
        Task guarded = Task.generic("B").withBoundaryEvents(List.of(
                Event.boundary("Late", new EventTrigger.Timer("PT1M"))));
        graph = new GraphBuilder().build(ProcessBuilder.process("Topo")
                .start("S").task("A").element(guarded).task("C").end("E")
                .task("X").task("Y").task("Z")
                .flow("S", "A", "B", "C", "A")
                .flow("C", "E")
                .flow("Late", "E")
                .flow("X", "Y")
                .flow("Z", "Z")
                .build()).graph();
        members = graph.nodesIn(0);
        memberSet = new HashSet<>(members);
    }

    private int idx(String id) {
        return graph.findByQualifiedId(id).orElseThrow().index();
    }

    private List<String> ids(java.util.Collection<Integer> indices) {
        return GraphTopology.ids(graph, indices);
    }

    @Test
    void reachableFrom_followsEdgesAndOptionallyAssociations() {
        Set<Integer> plain = GraphTopology.reachableFrom(graph, List.of(idx("S")), memberSet, false);
        Set<Integer> withAssociations = GraphTopology.reachableFrom(graph, List.of(idx("S")), memberSet, true);

        assertThat(ids(plain)).containsExactlyInAnyOrder("S", "A", "B", "C", "E");
        assertThat(ids(withAssociations)).containsExactlyInAnyOrder("S", "A", "B", "Late", "C", "E");
    }

    @Test
    void reaching_countsBoundaryHostAsPredecessor() {
        Set<Integer> reaching = GraphTopology.reaching(graph, List.of(idx("E")), memberSet);

        assertThat(ids(reaching)).contains("Late", "B", "C", "A", "S").doesNotContain("X", "Y", "Z");
    }

    @Test
    void weakComponents_orderedByLowestIndex() {
        List<List<Integer>> components = GraphTopology.weakComponents(graph, members);

        assertThat(components).hasSize(3);
        assertThat(ids(components.get(0))).containsExactly("S", "A", "B", "Late", "C", "E");
        assertThat(ids(components.get(1))).containsExactly("X", "Y");
        assertThat(ids(components.get(2))).containsExactly("Z");
    }

    @Test
    void stronglyConnectedComponents_findsLoopAndSelfLoop() {
        List<List<Integer>> cycles = GraphTopology.stronglyConnectedComponents(graph, members).stream()
                .filter(c -> GraphTopology.isCycle(graph, c))
                .toList();

        assertThat(cycles).hasSize(2);
        assertThat(ids(cycles.get(0))).containsExactly("A", "B", "C");
        assertThat(ids(cycles.get(1))).containsExactly("Z");
    }

    @Test
    void shortestCycle_repeatsStartAtTheEnd() {
        List<Integer> cycle = GraphTopology.shortestCycle(graph, idx("A"), Set.of(idx("A"), idx("B"), idx("C")));

        assertThat(ids(cycle)).containsExactly("A", "B", "C", "A");
        assertThat(GraphTopology.shortestCycle(graph, idx("X"), memberSet)).isEmpty();
    }

    @Test
    void stronglyConnectedComponents_longCycle_doesNotExhaustTheStack() {
        int length = 20_000;
        ProcessBuilder builder = ProcessBuilder.process("Ring");
        String[] path = new String[length + 1];
        for (int i = 0; i < length; i++) {
            builder.task("T" + i);
            path[i] = "T" + i;
        }
        path[length] = "T0";
        ProcessGraph ring = new GraphBuilder().build(builder.flow(path).build()).graph();

        List<List<Integer>> components = GraphTopology.stronglyConnectedComponents(ring, ring.nodesIn(0));

        assertThat(components).hasSize(1);
        assertThat(components.get(0)).hasSize(length);
    }
}
