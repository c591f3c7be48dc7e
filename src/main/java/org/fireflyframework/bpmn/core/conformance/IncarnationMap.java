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

import org.fireflyframework.bpmn.model.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed side-table from concrete activity ids to the reference activity
 * names they incarnate, with the reverse lookup.
 */
public final class IncarnationMap {

    private final Map<NodeId, List<String>> targets;
    private final Map<String, List<NodeId>> incarnations;

    IncarnationMap(Map<NodeId, List<String>> targets) {
        Map<NodeId, List<String>> forward = new LinkedHashMap<>();
        Map<String, List<NodeId>> reverse = new LinkedHashMap<>();
        targets.forEach((concrete, refs) -> {
            forward.put(concrete, List.copyOf(refs));
            refs.forEach(ref -> reverse.computeIfAbsent(ref, k -> new ArrayList<>()).add(concrete));
        });
        this.targets = Collections.unmodifiableMap(forward);
        Map<String, List<NodeId>> frozen = new LinkedHashMap<>();
        reverse.forEach((ref, ids) -> frozen.put(ref, List.copyOf(ids)));
        this.incarnations = Collections.unmodifiableMap(frozen);
    }

    public static IncarnationMap empty() {
        return new IncarnationMap(Map.of());
    }

    public List<String> targetsOf(NodeId concrete) {
        return targets.getOrDefault(concrete, List.of());
    }

    public boolean isIncarnated(NodeId concrete) {
        return targets.containsKey(concrete);
    }

    /** Concrete activities incarnating the given reference activity, in declaration order. */
    public List<NodeId> incarnationsOf(String referenceName) {
        return incarnations.getOrDefault(referenceName, List.of());
    }

    public Map<NodeId, List<String>> asMap() {
        return targets;
    }

    public int size() {
        return targets.size();
    }
}
