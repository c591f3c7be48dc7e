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

package org.fireflyframework.bpmn.core.graph;

import org.fireflyframework.bpmn.model.Event;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.Gateway;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.Task;
import org.fireflyframework.bpmn.model.TaskType;

import java.util.Optional;

/**
 * A resolved vertex. {@code element} carries the declarative payload
 * unchanged; synthetic inline gateways carry a generated {@link Gateway}.
 *
 * @param id         scope-qualified identifier
 * @param name       identifier as declared
 * @param scope      index of the scope the node is declared in
 * @param attachedTo host node index for boundary events, otherwise {@code -1}
 * @param bodyScope  scope owned by a subprocess node, otherwise {@code -1}
 * @param lane       lane the element was declared in, or {@code null}
 */
public record GraphNode(
        int index,
        NodeId id,
        NodeId name,
        NodeKind kind,
        int scope,
        FlowElement element,
        int attachedTo,
        int bodyScope,
        NodeId lane,
        boolean synthetic
) {

    public boolean isFlowNode() {
        return kind.isFlowNode();
    }

    public boolean isStartEvent() {
        return kind == NodeKind.START_EVENT;
    }

    public boolean isEndEvent() {
        return kind == NodeKind.END_EVENT;
    }

    public Optional<Event> event() {
        return element instanceof Event e ? Optional.of(e) : Optional.empty();
    }

    public Optional<Gateway> gateway() {
        return element instanceof Gateway g ? Optional.of(g) : Optional.empty();
    }

    public GatewayKind gatewayKind() {
        return element instanceof Gateway g ? g.kind() : null;
    }

    public boolean isGatewayOf(NodeKind direction, GatewayKind gatewayKind) {
        return kind == direction && gatewayKind() == gatewayKind;
    }

    public boolean isReceiveTask() {
        return element instanceof Task t && t.type() == TaskType.RECEIVE;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }
}
