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

package org.fireflyframework.bpmn.model;

import java.util.List;
import java.util.Objects;

/**
 * A compound activity owning a nested scope. An event subprocess is marked
 * with {@code triggeredByEvent}; one without the flag is still treated as an
 * event subprocess when it has no flows and its start event carries a trigger.
 */
public record SubProcess(
        NodeId id,
        SubProcessType type,
        AdHocCharacteristics adHocCharacteristics,
        LoopCharacteristic loop,
        List<FlowElement> elements,
        List<Event> boundaryEvents,
        Modifier modifier,
        boolean triggeredByEvent,
        boolean forCompensation
) implements FlowElement {

    public SubProcess {
        Objects.requireNonNull(id, "id");
        type = type != null ? type : SubProcessType.EMBEDDED;
        elements = elements != null ? List.copyOf(elements) : List.of();
        boundaryEvents = boundaryEvents != null ? List.copyOf(boundaryEvents) : List.of();
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public static SubProcess embedded(String name, List<FlowElement> elements) {
        return new SubProcess(NodeId.of(name), SubProcessType.EMBEDDED, null, null, elements,
                List.of(), Modifier.NONE, false, false);
    }

    public static SubProcess transaction(String name, List<FlowElement> elements) {
        return new SubProcess(NodeId.of(name), SubProcessType.TRANSACTION, null, null, elements,
                List.of(), Modifier.NONE, false, false);
    }

    public static SubProcess adHoc(String name, String completionCondition, List<FlowElement> elements) {
        return new SubProcess(NodeId.of(name), SubProcessType.ADHOC,
                new AdHocCharacteristics(completionCondition), null, elements,
                List.of(), Modifier.NONE, false, false);
    }

    public static SubProcess eventTriggered(String name, List<FlowElement> elements) {
        return new SubProcess(NodeId.of(name), SubProcessType.EMBEDDED, null, null, elements,
                List.of(), Modifier.NONE, true, false);
    }

    public SubProcess withBoundaryEvents(List<Event> events) {
        return new SubProcess(id, type, adHocCharacteristics, loop, elements, events, modifier,
                triggeredByEvent, forCompensation);
    }

    public SubProcess withLoop(LoopCharacteristic loop) {
        return new SubProcess(id, type, adHocCharacteristics, loop, elements, boundaryEvents, modifier,
                triggeredByEvent, forCompensation);
    }

    public SubProcess asCompensation() {
        return new SubProcess(id, type, adHocCharacteristics, loop, elements, boundaryEvents, modifier,
                triggeredByEvent, true);
    }

    public boolean isTransaction() {
        return type == SubProcessType.TRANSACTION;
    }

    public boolean isAdHoc() {
        return type == SubProcessType.ADHOC;
    }
}
