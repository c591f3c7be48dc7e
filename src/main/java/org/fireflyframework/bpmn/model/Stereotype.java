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
 * A {@code <<key="value">>} annotation attached to a modifier.
 */
public record Stereotype(String key, String value) {

    public static final String INCARNATES = "incarnates";

    public Stereotype {
        Objects.requireNonNull(key, "key");
    }

    public static Stereotype marker(String key) {
        return new Stereotype(key, null);
    }

    public static Stereotype incarnates(String referenceName) {
        return new Stereotype(INCARNATES, referenceName);
    }

    public boolean isIncarnation() {
        return INCARNATES.equals(key);
    }

    @Override
    public String toString() {
        return value != null ? "<<" + key + "=\"" + value + "\">>" : "<<" + key + ">>";
    }
}
