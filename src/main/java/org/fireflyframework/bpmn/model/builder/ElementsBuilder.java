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

import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.FlowTarget;
import org.fireflyframework.bpmn.model.Gateway;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.SequenceFlow;
import org.fireflyframework.bpmn.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared fluent methods for anything that owns a list of flow elements:
 * the process itself, subprocess bodies and lanes.
 *
 * @param <B> the concrete builder type returned from each call
 */
public abstract class ElementsBuilder<B extends ElementsBuilder<B>> {

    protected final List<FlowElement> elements = new ArrayList<>();
    private final AtomicInteger flowCounter;

    protected ElementsBuilder(AtomicInteger flowCounter) {
        this.flowCounter = flowCounter;
    }

    protected abstract B self();

    public B start(String name) {
        return element(Event.start(name));
    }

    public B end(String name) {
        return element(Event.end(name));
    }

    public B task(String name) {
        return element(Task.generic(name));
    }

    public B split(String name, GatewayKind kind) {
        return element(Gateway.split(name, kind));
    }

    public B merge(String name, GatewayKind kind) {
        return element(Gateway.merge(name, kind));
    }

    public B element(FlowElement element) {
        elements.add(element);
        return self();
    }

    /**
     * Adds a linear flow {@code a -> b -> c} with a generated id.
     */
    public B flow(String... nodeNames) {
        return element(SequenceFlow.linear(nextFlowId(), nodeNames));
    }

    public B flow(FlowTarget... path) {
        return element(SequenceFlow.of(nextFlowId(), path));
    }

    public SubProcessBuilder<B> subProcess(String name) {
        return new SubProcessBuilder<>(self(), name, flowCounter);
    }

    public LaneBuilder<B> lane(String name) {
        return new LaneBuilder<>(self(), name, flowCounter);
    }

    protected String nextFlowId() {
        return "flow" + flowCounter.incrementAndGet();
    }
}
