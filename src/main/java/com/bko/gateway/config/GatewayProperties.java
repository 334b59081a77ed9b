package com.bko.gateway.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private LockConfig lock = new LockConfig();
    private JobsConfig jobs = new JobsConfig();
    private CliConfig cli = new CliConfig();
    private TailConfig tail = new TailConfig();
    private StreamConfig stream = new StreamConfig();

    public enum LockStoreType {
        REDIS, MEMORY
    }

    public static class LockConfig {
        private LockStoreType store = LockStoreType.REDIS;
        private Duration ttl = Duration.ofHours(1);
        private String keyPrefix = "session:active:";

        public LockStoreType getStore() { return store; }
        public void setStore(LockStoreType store) { this.store = store; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    public static class JobsConfig {
        private Duration retention = Duration.ofMinutes(30);

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class CliConfig {
        private String binary = "codex";
        private String sessionsRoot;
        private Duration discoveryTimeout = Duration.ofSeconds(60);
        private Duration discoveryPollInterval = Duration.ofMillis(250);
        private Duration killGracePeriod = Duration.ofSeconds(3);
        private String approvalPolicy = "never";
        private String reasoningEffort = "high";

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getSessionsRoot() { return sessionsRoot; }
        public void setSessionsRoot(String sessionsRoot) { this.sessionsRoot = sessionsRoot; }
        public Duration getDiscoveryTimeout() { return discoveryTimeout; }
        public void setDiscoveryTimeout(Duration discoveryTimeout) { this.discoveryTimeout = discoveryTimeout; }
        public Duration getDiscoveryPollInterval() { return discoveryPollInterval; }
        public void setDiscoveryPollInterval(Duration discoveryPollInterval) { this.discoveryPollInterval = discoveryPollInterval; }
        public Duration getKillGracePeriod() { return killGracePeriod; }
        public void setKillGracePeriod(Duration killGracePeriod) { this.killGracePeriod = killGracePeriod; }
        public String getApprovalPolicy() { return approvalPolicy; }
        public void setApprovalPolicy(String approvalPolicy) { this.approvalPolicy = approvalPolicy; }
        public String getReasoningEffort() { return reasoningEffort; }
        public void setReasoningEffort(String reasoningEffort) { this.reasoningEffort = reasoningEffort; }

        public Path resolveSessionsRoot() {
            if (sessionsRoot == null || sessionsRoot.isBlank()) {
                return Path.of(System.getProperty("user.home"), ".codex", "sessions");
            }
            if (sessionsRoot.startsWith("~/")) {
                return Path.of(System.getProperty("user.home")).resolve(sessionsRoot.substring(2));
            }
            return Path.of(sessionsRoot);
        }
    }

    public static class TailConfig {
        private Duration pollInterval = Duration.ofMillis(500);
        private int readChunkSize = 1 << 20;

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getReadChunkSize() { return readChunkSize; }
        public void setReadChunkSize(int readChunkSize) { this.readChunkSize = readChunkSize; }
    }

    public static class StreamConfig {
        private Duration keepaliveInterval = Duration.ofSeconds(30);

        public Duration getKeepaliveInterval() { return keepaliveInterval; }
        public void setKeepaliveInterval(Duration keepaliveInterval) { this.keepaliveInterval = keepaliveInterval; }
    }

    public LockConfig getLock() {
        return lock;
    }

    public void setLock(LockConfig lock) {
        this.lock = lock != null ? lock : new LockConfig();
    }

    public JobsConfig getJobs() {
        return jobs;
    }

    public void setJobs(JobsConfig jobs) {
        this.jobs = jobs != null ? jobs : new JobsConfig();
    }

    public CliConfig getCli() {
        return cli;
    }

    public void setCli(CliConfig cli) {
        this.cli = cli != null ? cli : new CliConfig();
    }

    public TailConfig getTail() {
        return tail;
    }

    public void setTail(TailConfig tail) {
        this.tail = tail != null ? tail : new TailConfig();
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream != null ? stream : new StreamConfig();
    }
}
