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

public record TaskTypeAttributes(
        String webservice,
        NodeId operation,
        NodeId message,
        List<String> resources,
        String scriptFormat,
        String script
) {
    public TaskTypeAttributes {
        resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public static TaskTypeAttributes webService(String webservice, NodeId operation) {
        return new TaskTypeAttributes(webservice, operation, null, List.of(), null, null);
    }

    public static TaskTypeAttributes messaging(String webservice, NodeId message) {
        return new TaskTypeAttributes(webservice, null, message, List.of(), null, null);
    }

    public static TaskTypeAttributes manual(List<String> resources) {
        return new TaskTypeAttributes(null, null, null, resources, null, null);
    }

    public static TaskTypeAttributes script(String format, String body) {
        return new TaskTypeAttributes(null, null, null, List.of(), format, body);
    }
}
