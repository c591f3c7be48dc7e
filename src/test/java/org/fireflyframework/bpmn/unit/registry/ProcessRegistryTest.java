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


package org.fireflyframework.bpmn.unit.registry;

import org.fireflyframework.bpmn.core.exception.DuplicateProcessException;
import org.fireflyframework.bpmn.core.exception.ProcessNotFoundException;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.fireflyframework.bpmn.registry.ProcessRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProcessRegistryTest {

    private static WorkflowProcess process(String name) {
        return ProcessBuilder.process(name).start("S").end("E").flow("S", "E").build();
    }

    @Test
    void register_thenLookupByName() {
        var registry = new ProcessRegistry();
        var order = process("Order");

        registry.register(order);

        assertThat(registry.hasProcess("Order")).isTrue();
        assertThat(registry.contains(NodeId.of("Order"))).isTrue();
        assertThat(registry.getProcess("Order")).isSameAs(order);
        assertThat(registry.get("Order")).containsSame(order);
        assertThat(registry.getAll()).containsExactly(order);
    }

    @Test
    void register_duplicateName_throws() {
        var registry = new ProcessRegistry();
        registry.register(process("Order"));

        assertThatThrownBy(() -> registry.register(process("Order")))
                .isInstanceOf(DuplicateProcessException.class)
                .hasMessageContaining("Order")
                .extracting("code").isEqualTo("BPMN_DUPLICATE_PROCESS");
    }

    @Test
    void getProcess_unknown_throwsNotFound() {
        var registry = new ProcessRegistry();

        assertThatThrownBy(() -> registry.getProcess("Missing"))
                .isInstanceOf(ProcessNotFoundException.class)
                .hasMessageContaining("Missing");
        assertThat(registry.get("Missing")).isEmpty();
        assertThat(registry.contains(NodeId.of("Missing"))).isFalse();
    }

    @Test
    void unregister_removesProcess() {
        var registry = new ProcessRegistry();
        registry.register(process("Order"));

        registry.unregister("Order");

        assertThat(registry.hasProcess("Order")).isFalse();
        assertThat(registry.getAll()).isEmpty();
    }
}
