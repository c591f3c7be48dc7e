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
 * A lane partitions the elements of its enclosing process. Elements declared
 * in a lane share the process scope.
 */
public record Lane(NodeId id, List<FlowElement> elements, Modifier modifier) implements FlowElement {

    public Lane {
        Objects.requireNonNull(id, "id");
        elements = elements != null ? List.copyOf(elements) : List.of();
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public Lane(String name, List<FlowElement> elements) {
        this(NodeId.of(name), elements, Modifier.NONE);
    }
}
