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

package org.fireflyframework.bpmn.core.failure;

/**
 * Stable tag of a {@link WorkflowFailure}, intended for programmatic matching.
 */
public enum FailureKind {
    START_EVENT_IS_THROWING(FailureCategory.STRUCTURAL),
    START_EVENT_HAS_INCOMING_FLOW(FailureCategory.STRUCTURAL),
    END_EVENT_IS_CATCHING(FailureCategory.STRUCTURAL),
    END_EVENT_HAS_OUTGOING_FLOW(FailureCategory.STRUCTURAL),
    NO_END_EVENT_WITH_START_EVENT(FailureCategory.STRUCTURAL),
    BOUNDARY_EVENT_HAS_INCOMING_FLOW(FailureCategory.STRUCTURAL),
    SPLIT_GATEWAY_TOO_FEW_OUTGOING_FLOWS(FailureCategory.STRUCTURAL),
    MERGE_GATEWAY_TOO_FEW_INCOMING_FLOWS(FailureCategory.STRUCTURAL),
    EVENT_GATEWAY_IS_NOT_SPLIT(FailureCategory.STRUCTURAL),
    EVENT_GATEWAY_MIXED_TARGET_TYPES(FailureCategory.STRUCTURAL),
    AD_HOC_SUB_PROCESS_EMPTY(FailureCategory.STRUCTURAL),
    AD_HOC_SUB_PROCESS_HAS_START_OR_END_EVENT(FailureCategory.STRUCTURAL),
    EVENT_SUB_PROCESS_HAS_FLOW(FailureCategory.STRUCTURAL),
    EVENT_SUB_PROCESS_START_EVENT_COUNT(FailureCategory.STRUCTURAL),
    COMPENSATION_ACTIVITY_HAS_FLOW(FailureCategory.STRUCTURAL),
    LOOP_COUNT_NOT_INTEGER(FailureCategory.STRUCTURAL),
    CANCEL_EVENT_OUTSIDE_TRANSACTION(FailureCategory.STRUCTURAL),
    MULTIPLE_DEFAULT_BRANCHES(FailureCategory.STRUCTURAL),
    DEFAULT_BRANCH_NOT_LAST(FailureCategory.STRUCTURAL),

    UNRESOLVED_NODE_REFERENCE(FailureCategory.REFERENCE),
    SEQUENCE_FLOW_CROSSES_BOUNDARY(FailureCategory.REFERENCE),
    CALLED_ELEMENT_NOT_FOUND(FailureCategory.REFERENCE),
    DUPLICATE_NODE_ID(FailureCategory.REFERENCE),

    DEAD_NODE(FailureCategory.SOUNDNESS),
    DISCONNECTED_COMPONENT(FailureCategory.SOUNDNESS),
    INFINITE_LOOP(FailureCategory.SOUNDNESS),
    LACK_OF_SYNC(FailureCategory.SOUNDNESS),
    SYNC_DEADLOCK(FailureCategory.SOUNDNESS),
    PROCESS_NOT_SOUND(FailureCategory.SOUNDNESS),

    TASK_NOT_INCARNATED(FailureCategory.CONFORMANCE),
    PARALLEL_BRANCHES_CLOSED_WITH_XOR(FailureCategory.CONFORMANCE);

    private final FailureCategory category;

    FailureKind(FailureCategory category) {
        this.category = category;
    }

    public FailureCategory category() {
        return category;
    }
}
