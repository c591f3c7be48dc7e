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


package org.fireflyframework.bpmn.model.builder;

import org.fireflyframework.bpmn.model.Modifier;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.WorkflowProcess;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fluent builder for assembling a {@link WorkflowProcess} in code.
 *
 * <pre>{@code
 * WorkflowProcess process = ProcessBuilder.process("Order")
 *         .start("S").task("T").end("E")
 *         .flow("S", "T", "E")
 *         .build();
 * }</pre>
 */
public class ProcessBuilder extends ElementsBuilder<ProcessBuilder> {

    private final String name;
    private Modifier modifier = Modifier.NONE;

    public ProcessBuilder(String name) {
        super(new AtomicInteger());
        this.name = name;
    }

    public static ProcessBuilder process(String name) {
        return new ProcessBuilder(name);
    }

    @Override
    protected ProcessBuilder self() {
        return this;
    }

    public ProcessBuilder modifier(Modifier modifier) {
        this.modifier = modifier;
        return this;
    }

    public WorkflowProcess build() {
        return new WorkflowProcess(NodeId.of(name), modifier, elements);
    }
}
