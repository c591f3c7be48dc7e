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
import org.fireflyframework.bpmn.model.LoopCharacteristic;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.SubProcessType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a subprocess body and adds the finished subprocess to its parent on {@link #add()}.
 */
public class SubProcessBuilder<P extends ElementsBuilder<P>> extends ElementsBuilder<SubProcessBuilder<P>> {

    private final P parent;
    private final String name;
    private SubProcessType type = SubProcessType.EMBEDDED;
    private String completionCondition;
    private boolean triggeredByEvent;
    private boolean forCompensation;
    private LoopCharacteristic loop;
    private final List<Event> boundaryEvents = new ArrayList<>();

    SubProcessBuilder(P parent, String name, AtomicInteger flowCounter) {
        super(flowCounter);
        this.parent = parent;
        this.name = name;
    }

    @Override
    protected SubProcessBuilder<P> self() {
        return this;
    }

    public SubProcessBuilder<P> transaction() {
        this.type = SubProcessType.TRANSACTION;
        return this;
    }

    public SubProcessBuilder<P> adHoc(String completionCondition) {
        this.type = SubProcessType.ADHOC;
        this.completionCondition = completionCondition;
        return this;
    }

    public SubProcessBuilder<P> triggeredByEvent() {
        this.triggeredByEvent = true;
        return this;
    }

    public SubProcessBuilder<P> forCompensation() {
        this.forCompensation = true;
        return this;
    }

    public SubProcessBuilder<P> loop(LoopCharacteristic loop) {
        this.loop = loop;
        return this;
    }

    public SubProcessBuilder<P> boundary(Event event) {
        boundaryEvents.add(event);
        return this;
    }

    public SubProcess toSubProcess() {
        SubProcess subProcess = switch (type) {
            case TRANSACTION -> SubProcess.transaction(name, elements);
            case ADHOC -> SubProcess.adHoc(name, completionCondition, elements);
            case EMBEDDED -> triggeredByEvent
                    ? SubProcess.eventTriggered(name, elements)
                    : SubProcess.embedded(name, elements);
        };
        if (loop != null) {
            subProcess = subProcess.withLoop(loop);
        }
        if (!boundaryEvents.isEmpty()) {
            subProcess = subProcess.withBoundaryEvents(boundaryEvents);
        }
        return forCompensation ? subProcess.asCompensation() : subProcess;
    }

    public P add() {
        return parent.element(toSubProcess());
    }
}
