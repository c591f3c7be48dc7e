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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Visibility plus stereotypes declared on an element.
 */
public record Modifier(Visibility visibility, List<Stereotype> stereotypes) {

    public static final Modifier NONE = new Modifier(Visibility.UNSPECIFIED, List.of());

    public Modifier {
        visibility = visibility != null ? visibility : Visibility.UNSPECIFIED;
        stereotypes = stereotypes != null ? List.copyOf(stereotypes) : List.of();
    }

    public static Modifier of(Stereotype... stereotypes) {
        return new Modifier(Visibility.UNSPECIFIED, List.of(stereotypes));
    }

    public static Modifier incarnating(String referenceName) {
        return of(Stereotype.incarnates(referenceName));
    }

    public boolean isIncarnation() {
        return stereotypes.stream().anyMatch(Stereotype::isIncarnation);
    }

    public Optional<String> incarnatesTarget() {
        return stereotypes.stream()
                .filter(Stereotype::isIncarnation)
                .map(Stereotype::value)
                .filter(Objects::nonNull)
                .findFirst();
    }

    public List<String> incarnatesTargets() {
        return stereotypes.stream()
                .filter(Stereotype::isIncarnation)
                .map(Stereotype::value)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (visibility != Visibility.UNSPECIFIED) {
            parts.add(visibility.name().toLowerCase());
        }
        stereotypes.forEach(s -> parts.add(s.toString()));
        return String.join(" ", parts);
    }
}
