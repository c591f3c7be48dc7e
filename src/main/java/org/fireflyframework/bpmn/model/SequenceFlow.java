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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A declared flow path such as {@code A -> B -> { [c1] C; [_] D }}.
 */
public record SequenceFlow(NodeId id, List<FlowTarget> path) implements FlowElement {

    public SequenceFlow {
        Objects.requireNonNull(id, "id");
        path = path != null ? List.copyOf(path) : List.of();
    }

    public static SequenceFlow of(String id, FlowTarget... path) {
        return new SequenceFlow(NodeId.of(id), List.of(path));
    }

    public static SequenceFlow linear(String id, String... nodeNames) {
        return new SequenceFlow(NodeId.of(id), Arrays.stream(nodeNames).map(FlowTarget::element).toList());
    }
}
