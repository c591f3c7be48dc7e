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

import java.util.Map;

/**
 * Base of the exceptions raised for API misuse. Analysis findings are
 * returned as values and never surface through this hierarchy, except when a
 * caller explicitly asks for fail-fast behaviour.
 */
public class ProcessAnalysisException extends RuntimeException {
    private final String code;
    private final Map<String, Object> context;

    public ProcessAnalysisException(String message, String code) {
        this(message, code, Map.of(), null);
    }

    public ProcessAnalysisException(String message, String code, Throwable cause) {
        this(message, code, Map.of(), cause);
    }

    public ProcessAnalysisException(String message, String code, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
