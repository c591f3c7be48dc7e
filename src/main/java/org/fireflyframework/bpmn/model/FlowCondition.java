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
 * Guard on a flow step. Expressions are opaque strings; {@link Default}
 * is the {@code [_]} branch.
 */
public sealed interface FlowCondition {

    record Expression(String expression) implements FlowCondition {
        public Expression {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public String toString() {
            return "[" + expression + "]";
        }
    }

    record Default() implements FlowCondition {
        @Override
        public String toString() {
            return "[_]";
        }
    }

    static FlowCondition expression(String expression) {
        return new Expression(expression);
    }

    static FlowCondition otherwise() {
        return new Default();
    }

    default boolean isDefault() {
        return this instanceof Default;
    }
}
