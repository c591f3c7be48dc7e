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


package org.fireflyframework.bpmn.model.builder;

import org.fireflyframework.bpmn.model.Lane;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a lane. Lane members share the enclosing scope, so flow ids keep counting from the parent.
 */
public class LaneBuilder<P extends ElementsBuilder<P>> extends ElementsBuilder<LaneBuilder<P>> {

    private final P parent;
    private final String name;

    LaneBuilder(P parent, String name, AtomicInteger flowCounter) {
        super(flowCounter);
        this.parent = parent;
        this.name = name;
    }

    @Override
    protected LaneBuilder<P> self() {
        return this;
    }

    public P add() {
        return parent.element(new Lane(name, elements));
    }
}
