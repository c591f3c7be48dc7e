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

import java.util.Objects;

public record Event(
        NodeId id,
        EventRole role,
        EventDirection direction,
        EventTrigger trigger,
        Modifier modifier,
        boolean boundary,
        boolean nonInterrupting,
        CompensationHandler compensationHandler,
        NodeId operationRef
) implements FlowElement {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        direction = direction != null ? direction : EventDirection.UNSPECIFIED;
        modifier = modifier != null ? modifier : Modifier.NONE;
    }

    public static Event of(String name, EventRole role, EventDirection direction, EventTrigger trigger) {
        return new Event(NodeId.of(name), role, direction, trigger, Modifier.NONE, false, false, null, null);
    }

    public static Event start(String name) {
        return of(name, EventRole.START, EventDirection.CATCH, null);
    }

    public static Event end(String name) {
        return of(name, EventRole.END, EventDirection.THROW, null);
    }

    public static Event terminate(String name) {
        return of(name, EventRole.END, EventDirection.THROW, new EventTrigger.Terminate());
    }

    public static Event intermediate(String name) {
        return of(name, EventRole.INTERMEDIATE, EventDirection.UNSPECIFIED, null);
    }

    public static Event messageCatchStart(String name, String messageName) {
        return of(name, EventRole.START, EventDirection.CATCH, EventTrigger.message(messageName));
    }

    public static Event messageCatch(String name, String messageName) {
        return of(name, EventRole.INTERMEDIATE, EventDirection.CATCH, EventTrigger.message(messageName));
    }

    public static Event timerCatch(String name, String timerCondition) {
        return of(name, EventRole.INTERMEDIATE, EventDirection.CATCH, new EventTrigger.Timer(timerCondition));
    }

    public static Event errorEnd(String name, String errorName) {
        return of(name, EventRole.END, EventDirection.THROW,
                new EventTrigger.Notification(NotificationKind.ERROR, NodeId.of(errorName)));
    }

    public static Event boundary(String name, EventTrigger trigger) {
        return new Event(NodeId.of(name), EventRole.INTERMEDIATE, EventDirection.CATCH, trigger,
                Modifier.NONE, true, false, null, null);
    }

    public static Event compensationBoundary(String name, String compensatedActivity, String handlerActivity) {
        return new Event(NodeId.of(name), EventRole.INTERMEDIATE, EventDirection.CATCH,
                new EventTrigger.Compensate(NodeId.of(compensatedActivity), false),
                Modifier.NONE, true, false,
                new CompensationHandler(NodeId.of(compensatedActivity), NodeId.of(handlerActivity)), null);
    }

    public boolean isStart() {
        return role == EventRole.START;
    }

    public boolean isEnd() {
        return role == EventRole.END;
    }

    public boolean isMessage() {
        return trigger instanceof EventTrigger.Notification n && n.kind() == NotificationKind.MESSAGE;
    }

    public boolean isTimer() {
        return trigger instanceof EventTrigger.Timer;
    }
}
