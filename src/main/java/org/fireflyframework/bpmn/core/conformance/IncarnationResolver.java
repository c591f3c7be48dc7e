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

package org.fireflyframework.bpmn.core.conformance;

import org.fireflyframework.bpmn.core.graph.GraphNode;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.model.CallActivity;
import org.fireflyframework.bpmn.model.FlowElement;
import org.fireflyframework.bpmn.model.Modifier;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SubProcess;
import org.fireflyframework.bpmn.model.Task;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects {@code <<incarnates="...">>} stereotypes of every activity in a
 * concrete graph into an {@link IncarnationMap}.
 */
public class IncarnationResolver {

    public IncarnationMap resolve(ProcessGraph concrete) {
        Map<NodeId, List<String>> targets = new LinkedHashMap<>();
        for (GraphNode node : concrete.nodes()) {
            if (!node.kind().isActivity()) {
                continue;
            }
            List<String> refs = modifierOf(node.element()).incarnatesTargets();
            if (!refs.isEmpty()) {
                targets.put(node.id(), refs);
            }
        }
        return new IncarnationMap(targets);
    }

    private static Modifier modifierOf(FlowElement element) {
        if (element instanceof Task task) return task.modifier();
        if (element instanceof SubProcess sub) return sub.modifier();
        if (element instanceof CallActivity call) return call.modifier();
        return Modifier.NONE;
    }
}
