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
import java.util.stream.Collectors;

/**
 * What causes an event to fire, or what it throws.
 */
public sealed interface EventTrigger {

    record Cancel() implements EventTrigger {
        @Override
        public String toString() {
            return "cancel";
        }
    }

    record Compensate(NodeId activity, boolean async) implements EventTrigger {
        @Override
        public String toString() {
            return "compensate" + (activity != null ? " " + activity : "") + (async ? " async" : "");
        }
    }

    record Conditional(String condition) implements EventTrigger {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public String toString() {
            return "when [" + condition + "]";
        }
    }

    record Terminate() implements EventTrigger {
        @Override
        public String toString() {
            return "terminate";
        }
    }

    record Timer(String condition) implements EventTrigger {
        public Timer {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public String toString() {
            return "timer [" + condition + "]";
        }
    }

    record Notification(NotificationKind kind, NodeId notificationName) implements EventTrigger {
        public Notification {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(notificationName, "notificationName");
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase() + " " + notificationName;
        }
    }

    record Multiple(List<EventTrigger> triggers, boolean parallel) implements EventTrigger {
        public Multiple {
            triggers = List.copyOf(triggers);
        }

        @Override
        public String toString() {
            return (parallel ? "all" : "one") + " { "
                    + triggers.stream().map(Object::toString).collect(Collectors.joining(", ")) + " }";
        }
    }

    static EventTrigger message(String name) {
        return new Notification(NotificationKind.MESSAGE, NodeId.of(name));
    }

    /**
     * True when this trigger is, or contains, a trigger of the given type.
     */
    default boolean involves(Class<? extends EventTrigger> type) {
        if (type.isInstance(this)) {
            return true;
        }
        return this instanceof Multiple multiple
                && multiple.triggers().stream().anyMatch(t -> t.involves(type));
    }
}
