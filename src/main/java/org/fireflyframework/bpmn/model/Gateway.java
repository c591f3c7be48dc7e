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

import java.util.Objects;

/**
 * A named gateway. {@code guard} is only meaningful for complex gateways.
 */
public record Gateway(
        NodeId id,
        GatewayDirection direction,
        GatewayKind kind,
        String guard,
        Integer activationCount,
        Modifier modifier
) implements FlowElement {

    public Gateway {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(kind, "kind");
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public static Gateway of(String name, GatewayDirection direction, GatewayKind kind) {
        return new Gateway(NodeId.of(name), direction, kind, null, null, Modifier.NONE);
    }

    public static Gateway split(String name, GatewayKind kind) {
        return of(name, GatewayDirection.SPLIT, kind);
    }

    public static Gateway merge(String name, GatewayKind kind) {
        return of(name, GatewayDirection.MERGE, kind);
    }

    public static Gateway complex(String name, GatewayDirection direction, String guard) {
        return new Gateway(NodeId.of(name), direction, GatewayKind.COMPLEX, guard, null, Modifier.NONE);
    }

    public boolean isSplit() {
        return direction == GatewayDirection.SPLIT;
    }
}
