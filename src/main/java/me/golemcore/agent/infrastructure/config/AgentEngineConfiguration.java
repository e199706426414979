package me.golemcore.agent.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.llm.Langchain4jLlmAdapter;
import me.golemcore.agent.adapter.outbound.storage.HistoryJsonCodec;
import me.golemcore.agent.adapter.outbound.storage.InMemoryHistoryStore;
import me.golemcore.agent.domain.event.DefaultEventCoordinator;
import me.golemcore.agent.domain.history.ContextManager;
import me.golemcore.agent.domain.history.ContextProvider;
import me.golemcore.agent.domain.history.DefaultContextManager;
import me.golemcore.agent.domain.history.LlmSummarizer;
import me.golemcore.agent.domain.history.ReductionTrigger;
import me.golemcore.agent.domain.history.Summarizer;
import me.golemcore.agent.domain.loop.AgentEngine;
import me.golemcore.agent.domain.loop.AgentLoop;
import me.golemcore.agent.domain.loop.DefaultAgentLoop;
import me.golemcore.agent.domain.loop.DefaultHistoryWriter;
import me.golemcore.agent.domain.loop.HistoryWriter;
import me.golemcore.agent.domain.retry.CredentialRefresher;
import me.golemcore.agent.domain.retry.DefaultErrorClassifier;
import me.golemcore.agent.domain.retry.ErrorClassifier;
import me.golemcore.agent.domain.retry.RetryEngine;
import me.golemcore.agent.domain.retry.RetryExecutor;
import me.golemcore.agent.domain.retry.RetryStrategy;
import me.golemcore.agent.domain.tools.AdmissionCheck;
import me.golemcore.agent.domain.tools.DefaultToolCallScheduler;
import me.golemcore.agent.domain.tools.PermissionAdmissionCheck;
import me.golemcore.agent.domain.tools.ToolCallScheduler;
import me.golemcore.agent.port.outbound.FunctionRegistryPort;
import me.golemcore.agent.port.outbound.HistoryStorePort;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the agent engine from {@code agent.*} properties.
 *
 * <p>
 * The application supplies a {@link FunctionRegistryPort} and either an
 * {@link LlmPort} or a langchain4j {@link ChatModel}. Everything else has a
 * default that backs off when the application defines its own bean.
 */
@AutoConfiguration
@EnableConfigurationProperties(AgentEngineProperties.class)
@Slf4j
public class AgentEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock agentClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnBean(ChatModel.class)
    @ConditionalOnMissingBean(LlmPort.class)
    public LlmPort langchain4jLlmPort(ChatModel chatModel, AgentEngineProperties properties) {
        log.info("[Loop] Using langchain4j chat model {}", chatModel.getClass().getSimpleName());
        return new Langchain4jLlmAdapter("langchain4j", chatModel, properties.getModel().getName(),
                HistoryJsonCodec.defaultObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultEventCoordinator agentEventCoordinator() {
        return new DefaultEventCoordinator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new DefaultErrorClassifier();
    }

    @Bean
    public RetryExecutor modelRetryExecutor(AgentEngineProperties properties, ErrorClassifier errorClassifier,
            ObjectProvider<RetryStrategy> retryStrategy, ObjectProvider<CredentialRefresher> credentialRefresher,
            Clock clock) {
        RetryEngine engine = new RetryEngine(properties.getRetry().toPolicy(), errorClassifier,
                retryStrategy.getIfAvailable(), () -> ThreadLocalRandom.current().nextDouble());
        return new RetryExecutor(engine, credentialRefresher.getIfAvailable(), clock);
    }

    @Bean
    public RetryExecutor toolRetryExecutor(AgentEngineProperties properties, ErrorClassifier errorClassifier,
            Clock clock) {
        RetryEngine engine = new RetryEngine(properties.getTools().getRetry().toPolicy(), errorClassifier);
        return new RetryExecutor(engine, null, clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentToolExecutor(AgentEngineProperties properties) {
        int threads = Math.max(1, properties.getTools().getMaxParallelism());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "agent-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentToolCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "agent-tool-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public PermissionAdmissionCheck permissionAdmissionCheck(AgentEngineProperties properties) {
        return new PermissionAdmissionCheck(properties.getCoordination());
    }

    @Bean
    @ConditionalOnBean(FunctionRegistryPort.class)
    @ConditionalOnMissingBean
    public ToolCallScheduler toolCallScheduler(FunctionRegistryPort registry, List<AdmissionCheck> admissionChecks,
            @Qualifier("toolRetryExecutor") RetryExecutor toolRetryExecutor,
            @Qualifier("agentToolExecutor") ExecutorService agentToolExecutor,
            @Qualifier("agentToolCallExecutor") ExecutorService agentToolCallExecutor,
            AgentEngineProperties properties) {
        return new DefaultToolCallScheduler(registry, admissionChecks, toolRetryExecutor, agentToolExecutor,
                agentToolCallExecutor, properties.getTools());
    }

    @Bean
    @ConditionalOnBean(LlmPort.class)
    @ConditionalOnMissingBean
    public Summarizer summarizer(LlmPort llmPort, AgentEngineProperties properties, Clock clock) {
        return new LlmSummarizer(llmPort, properties.getHistory(), properties.getModel().getName(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextManager contextManager(AgentEngineProperties properties, ObjectProvider<Summarizer> summarizer,
            ObjectProvider<ContextProvider> contextProviders, ObjectProvider<ReductionTrigger> reductionTrigger,
            Clock clock) {
        return new DefaultContextManager(properties.getHistory(), summarizer.getIfAvailable(),
                contextProviders.orderedStream().toList(), reductionTrigger.getIfAvailable(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryWriter historyWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryStorePort historyStore(Clock clock) {
        return new InMemoryHistoryStore(new HistoryJsonCodec(), clock);
    }

    @Bean
    @ConditionalOnBean({ LlmPort.class, FunctionRegistryPort.class })
    @ConditionalOnMissingBean
    public AgentLoop agentLoop(LlmPort llmPort, FunctionRegistryPort registry, ToolCallScheduler toolCallScheduler,
            ContextManager contextManager, @Qualifier("modelRetryExecutor") RetryExecutor modelRetryExecutor,
            DefaultEventCoordinator agentEventCoordinator, HistoryWriter historyWriter,
            AgentEngineProperties properties) {
        return new DefaultAgentLoop(llmPort, registry, toolCallScheduler, contextManager, modelRetryExecutor,
                agentEventCoordinator, historyWriter, properties.getLoop(), properties.getModel());
    }

    @Bean
    @ConditionalOnBean(AgentLoop.class)
    @ConditionalOnMissingBean
    public AgentEngine agentEngine(AgentLoop agentLoop, ContextManager contextManager,
            HistoryStorePort historyStore, AgentEngineProperties properties, Clock clock) {
        return new AgentEngine(agentLoop, contextManager, historyStore, properties.getLoop(), clock);
    }
}
