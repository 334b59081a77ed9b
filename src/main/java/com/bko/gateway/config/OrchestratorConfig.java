package com.bko.gateway.config;

import com.bko.gateway.agent.cli.CliCommandBuilder;
import com.bko.gateway.agent.cli.LogTailer;
import com.bko.gateway.agent.cli.RolloutSessionDiscovery;
import com.bko.gateway.agent.cli.SessionDiscoveryStrategy;
import com.bko.gateway.lock.InMemoryLockStore;
import com.bko.gateway.lock.LockStore;
import com.bko.gateway.lock.RedisLockStore;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.MessageChatMemoryAdvisor;
import org.springframework.ai.chat.memory.ChatMemory;
import org.springframework.ai.chat.memory.MessageWindowChatMemory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService jobExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentIoExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService sseKeepaliveScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.lock", name = "store", havingValue = "memory")
    public LockStore inMemoryLockStore() {
        return new InMemoryLockStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.lock", name = "store", havingValue = "redis", matchIfMissing = true)
    public LockStore redisLockStore(StringRedisTemplate redisTemplate) {
        return new RedisLockStore(redisTemplate);
    }

    @Bean
    public CliCommandBuilder cliCommandBuilder(GatewayProperties properties) {
        return new CliCommandBuilder(properties.getCli());
    }

    @Bean
    @ConditionalOnMissingBean(SessionDiscoveryStrategy.class)
    public SessionDiscoveryStrategy sessionDiscoveryStrategy(GatewayProperties properties) {
        return new RolloutSessionDiscovery(properties.getCli());
    }

    @Bean
    public LogTailer logTailer(GatewayProperties properties) {
        return new LogTailer(properties.getTail().getPollInterval(), properties.getTail().getReadChunkSize());
    }

    @Bean
    @ConditionalOnMissingBean(ChatMemory.class)
    public ChatMemory chatMemory() {
        return MessageWindowChatMemory.builder().build();
    }

    @Bean
    public ChatClient agentChatClient(ChatClient.Builder builder, ChatMemory chatMemory) {
        return builder
                .defaultAdvisors(MessageChatMemoryAdvisor.builder(chatMemory).build())
                .build();
    }
}
