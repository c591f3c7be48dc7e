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

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.bpmn.core.conformance.ConformanceChecker;
import org.fireflyframework.bpmn.core.conformance.IncarnationResolver;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.observability.AnalysisEvents;
import org.fireflyframework.bpmn.core.observability.AnalysisLoggerEvents;
import org.fireflyframework.bpmn.core.observability.AnalysisMetrics;
import org.fireflyframework.bpmn.core.observability.CompositeAnalysisEvents;
import org.fireflyframework.bpmn.core.soundness.SoundnessAnalyzer;
import org.fireflyframework.bpmn.core.validation.StructuralValidator;
import org.fireflyframework.bpmn.registry.ProcessRegistry;
import org.fireflyframework.bpmn.service.WorkflowAnalysisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for workflow analysis.
 *
 * <p>Wires the graph builder, the three analyzers, the process registry, the
 * observability callbacks and the {@link WorkflowAnalysisService} facade.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ProcessAnalysisProperties.class)
public class ProcessAnalysisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GraphBuilder graphBuilder() {
        return new GraphBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public StructuralValidator structuralValidator() {
        return new StructuralValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SoundnessAnalyzer soundnessAnalyzer(ProcessAnalysisProperties properties) {
        return new SoundnessAnalyzer(properties.getSoundness().isReportProcessNotSound());
    }

    @Bean
    @ConditionalOnMissingBean
    public IncarnationResolver incarnationResolver() {
        return new IncarnationResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConformanceChecker conformanceChecker(IncarnationResolver incarnationResolver) {
        return new ConformanceChecker(incarnationResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessRegistry processRegistry() {
        return new ProcessRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisLoggerEvents analysisLoggerEvents() {
        return new AnalysisLoggerEvents();
    }

    /**
     * Fans analysis callbacks out to the logger and, when present, the metrics recorder.
     * Both delegates are themselves {@link AnalysisEvents}, so this bean is matched by name and marked primary.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "analysisEvents")
    public AnalysisEvents analysisEvents(ObjectProvider<AnalysisLoggerEvents> loggerEvents,
                                         ObjectProvider<AnalysisMetrics> metrics) {
        List<AnalysisEvents> delegates = new ArrayList<>();
        AnalysisLoggerEvents logger = loggerEvents.getIfAvailable();
        if (logger != null) {
            delegates.add(logger);
        }
        AnalysisMetrics analysisMetrics = metrics.getIfAvailable();
        if (analysisMetrics != null) {
            delegates.add(analysisMetrics);
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeAnalysisEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowAnalysisService workflowAnalysisService(GraphBuilder graphBuilder,
                                                           StructuralValidator structuralValidator,
                                                           SoundnessAnalyzer soundnessAnalyzer,
                                                           ConformanceChecker conformanceChecker,
                                                           ProcessRegistry processRegistry,
                                                           AnalysisEvents analysisEvents,
                                                           ProcessAnalysisProperties properties) {
        ProcessAnalysisProperties.AnalysisProperties analysis = properties.getAnalysis();
        log.info("[bpmn-analysis] Analysis service initialized (parallelScopes={}, maxConcurrency={}, soundness={}, conformance={})",
                analysis.isParallelScopes(), analysis.getMaxConcurrency(),
                properties.getSoundness().isEnabled(), properties.getConformance().isEnabled());
        return new WorkflowAnalysisService(graphBuilder, structuralValidator, soundnessAnalyzer,
                conformanceChecker, processRegistry, analysisEvents,
                properties.getSoundness().isEnabled(), properties.getConformance().isEnabled(),
                analysis.isParallelScopes(), analysis.getMaxConcurrency());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(name = "firefly.bpmn.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AnalysisMetrics analysisMetrics(MeterRegistry meterRegistry) {
            log.info("[bpmn-analysis] Micrometer metrics enabled");
            return new AnalysisMetrics(meterRegistry);
        }
    }
}
