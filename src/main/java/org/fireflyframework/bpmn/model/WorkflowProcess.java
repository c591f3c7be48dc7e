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
 * Root of one declared process: lanes, flow elements and sequence flows.
 */
public record WorkflowProcess(NodeId id, Modifier modifier, List<FlowElement> elements) {

    public WorkflowProcess {
        Objects.requireNonNull(id, "id");
        modifier = modifier != null ? modifier : Modifier.NONE;
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public WorkflowProcess(String name, List<FlowElement> elements) {
        this(NodeId.of(name), Modifier.NONE, elements);
    }

    public List<Lane> lanes() {
        return elements.stream().filter(Lane.class::isInstance).map(Lane.class::cast).toList();
    }

    public boolean hasLanes() {
        return elements.stream().anyMatch(Lane.class::isInstance);
    }
}
