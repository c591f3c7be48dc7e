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

public sealed interface LoopCharacteristic {

    record StandardLoop(boolean whileLoop, String loopCondition, Integer maxIterations) implements LoopCharacteristic {
        public StandardLoop {
            Objects.requireNonNull(loopCondition, "loopCondition");
        }

        @Override
        public String toString() {
            return (whileLoop ? "while" : "until") + " [" + loopCondition + "]"
                    + (maxIterations != null ? " max " + maxIterations : "");
        }
    }

    record MultiInstanceLoop(
            LoopCardinality cardinality,
            boolean parallel,
            String completionCondition,
            List<String> loopDataInputs,
            List<String> loopDataOutputs
    ) implements LoopCharacteristic {
        public MultiInstanceLoop {
            Objects.requireNonNull(cardinality, "cardinality");
            loopDataInputs = loopDataInputs != null ? List.copyOf(loopDataInputs) : List.of();
            loopDataOutputs = loopDataOutputs != null ? List.copyOf(loopDataOutputs) : List.of();
        }

        public static MultiInstanceLoop parallelOver(String collectionName) {
            return new MultiInstanceLoop(LoopCardinality.collection(collectionName), true, null, null, null);
        }

        public static MultiInstanceLoop sequential(LoopCardinality cardinality) {
            return new MultiInstanceLoop(cardinality, false, null, null, null);
        }
    }
}
