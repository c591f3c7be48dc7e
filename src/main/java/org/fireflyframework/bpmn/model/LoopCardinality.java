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
 * How many instances a multi-instance loop creates. Exactly one of the three
 * forms is set.
 */
public record LoopCardinality(Integer literalCount, String expression, String collectionName) {

    public LoopCardinality {
        int set = (literalCount != null ? 1 : 0) + (expression != null ? 1 : 0) + (collectionName != null ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("LoopCardinality requires exactly one of count, expression or collection");
        }
    }

    public static LoopCardinality count(int count) {
        return new LoopCardinality(count, null, null);
    }

    public static LoopCardinality expression(String expression) {
        return new LoopCardinality(null, expression, null);
    }

    public static LoopCardinality collection(String collectionName) {
        return new LoopCardinality(null, null, collectionName);
    }

    @Override
    public String toString() {
        if (literalCount != null) return "count " + literalCount;
        if (expression != null) return "count [" + expression + "]";
        return "count " + collectionName;
    }
}
