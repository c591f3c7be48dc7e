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

package org.fireflyframework.bpmn.registry;

import org.fireflyframework.bpmn.core.exception.DuplicateProcessException;
import org.fireflyframework.bpmn.core.exception.ProcessNotFoundException;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Processes known to the compilation scope, keyed by process id. Call
 * activities resolve their called element against this registry.
 */
@Slf4j
public class ProcessRegistry {

    private final ConcurrentHashMap<String, WorkflowProcess> processes = new ConcurrentHashMap<>();

    public void register(WorkflowProcess process) {
        if (processes.putIfAbsent(process.id().value(), process) != null) {
            throw new DuplicateProcessException(process.id().value());
        }
        log.info("[bpmn-registry] Registered process '{}'", process.id());
    }

    public WorkflowProcess getProcess(String processId) {
        WorkflowProcess process = processes.get(processId);
        if (process == null) {
            throw new ProcessNotFoundException(processId);
        }
        return process;
    }

    public Optional<WorkflowProcess> get(String processId) {
        return Optional.ofNullable(processes.get(processId));
    }

    public boolean hasProcess(String processId) {
        return processes.containsKey(processId);
    }

    public boolean contains(NodeId processId) {
        return processes.containsKey(processId.value());
    }

    public Collection<WorkflowProcess> getAll() {
        return Collections.unmodifiableCollection(processes.values());
    }

    public void unregister(String processId) {
        processes.remove(processId);
    }
}
