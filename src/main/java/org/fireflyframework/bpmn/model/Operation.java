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

public record Operation(
        NodeId id,
        NodeId inParam,
        NodeId outParam,
        List<NodeId> thrownErrors,
        String implementation,
        Modifier modifier
) implements FlowElement {

    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(inParam, "inParam");
        thrownErrors = thrownErrors != null ? List.copyOf(thrownErrors) : List.of();
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public static Operation oneWay(String name, String input) {
        return new Operation(NodeId.of(name), NodeId.of(input), null, List.of(), null, Modifier.NONE);
    }

    public static Operation requestResponse(String name, String input, String output) {
        return new Operation(NodeId.of(name), NodeId.of(input), NodeId.of(output), List.of(), null, Modifier.NONE);
    }
}
