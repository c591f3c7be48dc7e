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

public enum GatewayKind {
    EXCLUSIVE("xor"),
    INCLUSIVE("ior"),
    PARALLEL("and"),
    EXCLUSIVE_EVENT("receive first"),
    PARALLEL_EVENT("receive all"),
    COMPLEX("complex");

    private final String label;

    GatewayKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isEventBased() {
        return this == EXCLUSIVE_EVENT || this == PARALLEL_EVENT;
    }

    /**
     * Whether a split of this kind may leave some of its branches without a token.
     */
    public boolean isConditional() {
        return this == EXCLUSIVE || this == INCLUSIVE || this == EXCLUSIVE_EVENT || this == COMPLEX;
    }

    @Override
    public String toString() {
        return label;
    }
}
