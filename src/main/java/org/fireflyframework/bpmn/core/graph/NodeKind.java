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

public enum NodeKind {
    START_EVENT,
    END_EVENT,
    INTERMEDIATE_EVENT,
    BOUNDARY_EVENT,
    TASK,
    SUBPROCESS,
    CALL_ACTIVITY,
    SPLIT_GATEWAY,
    MERGE_GATEWAY,
    DATA_OBJECT,
    NOTIFICATION,
    OPERATION,
    LANE;

    /** Nodes that take part in control flow. Data, notifications, operations and lanes do not. */
    public boolean isFlowNode() {
        return switch (this) {
            case DATA_OBJECT, NOTIFICATION, OPERATION, LANE -> false;
            default -> true;
        };
    }

    public boolean isActivity() {
        return this == TASK || this == SUBPROCESS || this == CALL_ACTIVITY;
    }

    public boolean isGateway() {
        return this == SPLIT_GATEWAY || this == MERGE_GATEWAY;
    }

    public boolean isEvent() {
        return this == START_EVENT || this == END_EVENT || this == INTERMEDIATE_EVENT || this == BOUNDARY_EVENT;
    }
}
