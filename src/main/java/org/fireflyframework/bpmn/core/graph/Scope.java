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

import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SubProcessType;

/**
 * A lexical container in the scope tree. {@code parent} and {@code ownerNode}
 * are arena indices, {@code -1} for the process root.
 */
public record Scope(
        int index,
        NodeId id,
        ScopeKind kind,
        int parent,
        int ownerNode,
        SubProcessType subProcessType,
        String prefix
) {

    public boolean isRoot() {
        return parent < 0;
    }

    public boolean isAdHoc() {
        return subProcessType == SubProcessType.ADHOC;
    }

    public boolean isTransaction() {
        return subProcessType == SubProcessType.TRANSACTION;
    }

    /** Qualifies a simple name declared in this scope. */
    public NodeId qualify(NodeId simpleName) {
        return prefix.isEmpty() ? simpleName : new NodeId(prefix + "." + simpleName.value());
    }
}
