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

/**
 * One step of a flow path: an optional guard plus exactly one of an element
 * reference, an inline gateway or a nested block.
 */
public record FlowTarget(FlowCondition condition, NodeId elementRef, InlineGateway inlineGateway, FlowBlock block) {

    public FlowTarget {
        int set = (elementRef != null ? 1 : 0) + (inlineGateway != null ? 1 : 0) + (block != null ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("FlowTarget requires exactly one of elementRef, inlineGateway or block");
        }
    }

    public static FlowTarget element(String name) {
        return new FlowTarget(null, NodeId.of(name), null, null);
    }

    public static FlowTarget element(String name, FlowCondition condition) {
        return new FlowTarget(condition, NodeId.of(name), null, null);
    }

    public static FlowTarget gateway(InlineGateway gateway) {
        return new FlowTarget(null, null, gateway, null);
    }

    public static FlowTarget gateway(InlineGateway gateway, FlowCondition condition) {
        return new FlowTarget(condition, null, gateway, null);
    }

    public static FlowTarget block(FlowBlock block) {
        return new FlowTarget(null, null, null, block);
    }

    public static FlowTarget block(FlowBlock block, FlowCondition condition) {
        return new FlowTarget(condition, null, null, block);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public boolean isElementRef() {
        return elementRef != null;
    }

    public boolean isGateway() {
        return inlineGateway != null;
    }

    public boolean isBlock() {
        return block != null;
    }
}
