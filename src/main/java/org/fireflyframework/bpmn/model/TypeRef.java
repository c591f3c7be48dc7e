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

/**
 * Reference to a class-diagram type. Resolution happens elsewhere; the
 * analyzer treats it as opaque.
 */
public record TypeRef(String name, List<TypeRef> arguments) {

    public TypeRef {
        Objects.requireNonNull(name, "name");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public static TypeRef named(String name) {
        return new TypeRef(name, List.of());
    }
}
