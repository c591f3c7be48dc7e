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
 * An atomic activity. Boundary events are declared on the task and attached
 * to it when the graph is built.
 */
public record Task(
        NodeId id,
        TaskType type,
        TaskTypeAttributes attributes,
        LoopCharacteristic loop,
        List<Event> boundaryEvents,
        Modifier modifier,
        boolean forCompensation
) implements FlowElement {

    public Task {
        Objects.requireNonNull(id, "id");
        type = type != null ? type : TaskType.GENERIC;
        boundaryEvents = boundaryEvents != null ? List.copyOf(boundaryEvents) : List.of();
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public static Task generic(String name) {
        return new Task(NodeId.of(name), TaskType.GENERIC, null, null, List.of(), Modifier.NONE, false);
    }

    public static Task of(String name, TaskType type) {
        return new Task(NodeId.of(name), type, null, null, List.of(), Modifier.NONE, false);
    }

    public static Task receive(String name, String webservice, String messageName) {
        return new Task(NodeId.of(name), TaskType.RECEIVE,
                TaskTypeAttributes.messaging(webservice, NodeId.of(messageName)),
                null, List.of(), Modifier.NONE, false);
    }

    public static Task incarnating(String name, String referenceName) {
        return new Task(NodeId.of(name), TaskType.GENERIC, null, null, List.of(),
                Modifier.incarnating(referenceName), false);
    }

    public Task withLoop(LoopCharacteristic loop) {
        return new Task(id, type, attributes, loop, boundaryEvents, modifier, forCompensation);
    }

    public Task withBoundaryEvents(List<Event> events) {
        return new Task(id, type, attributes, loop, events, modifier, forCompensation);
    }

    public Task withModifier(Modifier modifier) {
        return new Task(id, type, attributes, loop, boundaryEvents, modifier, forCompensation);
    }

    public Task asCompensation() {
        return new Task(id, type, attributes, loop, boundaryEvents, modifier, true);
    }

    public boolean isIncarnation() {
        return modifier.isIncarnation();
    }
}
