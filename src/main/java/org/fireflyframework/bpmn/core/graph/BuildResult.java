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

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;

import java.util.List;

/**
 * A best-effort graph plus every failure recorded while building it.
 */
public record BuildResult(ProcessGraph graph, List<WorkflowFailure> failures) {

    public BuildResult {
        failures = List.copyOf(failures);
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
