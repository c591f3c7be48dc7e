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


package org.fireflyframework.bpmn.unit.model;

import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.EventTrigger;
import org.fireflyframework.bpmn.model.Gateway;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.Lane;
import org.fireflyframework.bpmn.model.LoopCardinality;
import org.fireflyframework.bpmn.model.LoopCharacteristic;
import org.fireflyframework.bpmn.model.Modifier;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SequenceFlow;
import org.fireflyframework.bpmn.model.Stereotype;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.SubProcessType;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProcessBuilderTest {

    @Test
    void build_keepsDeclarationOrder() {
        WorkflowProcess process = ProcessBuilder.process("Order")
                .start("S").split("G", GatewayKind.PARALLEL).task("A").end("E")
                .flow("S", "G", "A", "E")
                .build();

        assertThat(process.id()).isEqualTo(NodeId.of("Order"));
        assertThat(process.modifier()).isEqualTo(Modifier.NONE);
        assertThat(process.elements()).hasSize(5);
        assertThat(process.elements().get(1)).isInstanceOfSatisfying(Gateway.class, g -> {
            assertThat(g.isSplit()).isTrue();
            assertThat(g.kind()).isEqualTo(GatewayKind.PARALLEL);
        });
        assertThat(process.elements().get(4)).isInstanceOfSatisfying(SequenceFlow.class,
                f -> assertThat(f.path()).hasSize(4));
    }

    @Test
    void flowIds_countAcrossNestedBuilders() {
        WorkflowProcess process = ProcessBuilder.process("Order")
                .start("S")
                .subProcess("Sub").start("IS").end("IE").flow("IS", "IE").add()
                .lane("Clerk").task("A").flow("A", "A").add()
                .end("E")
                .flow("S", "Sub", "E")
                .build();

        var sub = (SubProcess) process.elements().get(1);
        var lane = (Lane) process.elements().get(2);
        var topFlow = (SequenceFlow) process.elements().get(4);

        assertThat(((SequenceFlow) sub.elements().get(2)).id()).isEqualTo(NodeId.of("flow1"));
        assertThat(((SequenceFlow) lane.elements().get(1)).id()).isEqualTo(NodeId.of("flow2"));
        assertThat(topFlow.id()).isEqualTo(NodeId.of("flow3"));
        assertThat(process.hasLanes()).isTrue();
        assertThat(process.lanes()).containsExactly(lane);
    }

    @Test
    void subProcessBuilder_appliesTypeLoopAndBoundaries() {
        Event late = Event.boundary("Late", new EventTrigger.Timer("PT1H"));
        WorkflowProcess process = ProcessBuilder.process("Order")
                .subProcess("Pay").transaction()
                .loop(LoopCharacteristic.MultiInstanceLoop.sequential(LoopCardinality.count(3)))
                .boundary(late)
                .start("S").end("E").flow("S", "E")
                .add()
                .subProcess("Pick").adHoc("allPicked").task("A").add()
                .subProcess("OnError").triggeredByEvent().start("ES").end("EE").flow("ES", "EE").add()
                .subProcess("Undo").forCompensation().task("U").add()
                .build();

        var pay = (SubProcess) process.elements().get(0);
        var pick = (SubProcess) process.elements().get(1);
        var onError = (SubProcess) process.elements().get(2);
        var undo = (SubProcess) process.elements().get(3);

        assertThat(pay.isTransaction()).isTrue();
        assertThat(pay.loop()).isNotNull();
        assertThat(pay.boundaryEvents()).containsExactly(late);
        assertThat(pick.type()).isEqualTo(SubProcessType.ADHOC);
        assertThat(pick.adHocCharacteristics()).isNotNull();
        assertThat(onError.triggeredByEvent()).isTrue();
        assertThat(undo.forCompensation()).isTrue();
    }

    @Test
    void modifier_appliedToProcess() {
        WorkflowProcess process = ProcessBuilder.process("Concrete")
                .modifier(Modifier.of(Stereotype.marker("draft")))
                .build();

        assertThat(process.modifier().toString()).isEqualTo("<<draft>>");
        assertThat(process.elements()).isEmpty();
    }
}
