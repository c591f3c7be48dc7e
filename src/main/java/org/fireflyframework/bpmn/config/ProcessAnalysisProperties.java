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


package org.fireflyframework.bpmn.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties for workflow analysis.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   bpmn:
 *     analysis:
 *       parallel-scopes: true
 *       max-concurrency: 4
 *     soundness:
 *       enabled: true
 *       report-process-not-sound: true
 *     conformance:
 *       enabled: true
 *     metrics:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.bpmn")
public class ProcessAnalysisProperties {

    @NestedConfigurationProperty
    private AnalysisProperties analysis = new AnalysisProperties();

    @NestedConfigurationProperty
    private SoundnessProperties soundness = new SoundnessProperties();

    @NestedConfigurationProperty
    private ConformanceProperties conformance = new ConformanceProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    // --- Getters and Setters ---

    public AnalysisProperties getAnalysis() { return analysis; }
    public void setAnalysis(AnalysisProperties analysis) { this.analysis = analysis; }

    public SoundnessProperties getSoundness() { return soundness; }
    public void setSoundness(SoundnessProperties soundness) { this.soundness = soundness; }

    public ConformanceProperties getConformance() { return conformance; }
    public void setConformance(ConformanceProperties conformance) { this.conformance = conformance; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    // --- Nested Property Classes ---

    public static class AnalysisProperties {
        /** Analyse subprocess scopes concurrently in {@code validateAsync}. */
        private boolean parallelScopes = true;
        /** Upper bound on scopes analysed at the same time. */
        private int maxConcurrency = 4;

        public boolean isParallelScopes() { return parallelScopes; }
        public void setParallelScopes(boolean parallelScopes) { this.parallelScopes = parallelScopes; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class SoundnessProperties {
        private boolean enabled = true;
        private boolean reportProcessNotSound = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isReportProcessNotSound() { return reportProcessNotSound; }
        public void setReportProcessNotSound(boolean reportProcessNotSound) { this.reportProcessNotSound = reportProcessNotSound; }
    }

    public static class ConformanceProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
