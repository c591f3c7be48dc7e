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

package org.fireflyframework.bpmn.core.exception;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;

import java.util.List;
import java.util.Map;

public final class ProcessValidationException extends ProcessAnalysisException {
    private final String processId;
    private final List<WorkflowFailure> failures;

    public ProcessValidationException(String processId, List<WorkflowFailure> failures) {
        super("Process '" + processId + "' is invalid: " + failures.size() + " failure(s); first: "
                        + (failures.isEmpty() ? "none" : failures.get(0).message()),
                "BPMN_PROCESS_INVALID",
                Map.of("processId", processId, "failureCount", failures.size()),
                null);
        this.processId = processId;
        this.failures = List.copyOf(failures);
    }

    public String getProcessId() {
        return processId;
    }

    public List<WorkflowFailure> getFailures() {
        return failures;
    }
}
