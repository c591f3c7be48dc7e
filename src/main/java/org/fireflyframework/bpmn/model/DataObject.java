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

public record DataObject(NodeId id, DataKind kind, TypeRef type) implements FlowElement {

    public DataObject {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public static DataObject data(String name, String typeName) {
        return new DataObject(NodeId.of(name), DataKind.DATA_OBJECT, TypeRef.named(typeName));
    }

    public static DataObject store(String name, String typeName) {
        return new DataObject(NodeId.of(name), DataKind.DATA_STORE, TypeRef.named(typeName));
    }
}
