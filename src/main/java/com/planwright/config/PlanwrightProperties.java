package com.planwright.config;

import com.planwright.core.engine.StuckAction;
import com.planwright.core.engine.UncommittedChangesPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "planwright")
public class PlanwrightProperties {

    private Store store = new Store();
    private Orchestrator orchestrator = new Orchestrator();
    private Events events = new Events();
    private Ipc ipc = new Ipc();
    private Commit commit = new Commit();
    private Agent agent = new Agent();

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Ipc getIpc() { return ipc; }
    public void setIpc(Ipc ipc) { this.ipc = ipc; }
    public Commit getCommit() { return commit; }
    public void setCommit(Commit commit) { this.commit = commit; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }

    public static class Store {
        /** Directory holding one sub-directory per plan, the commit queue file and the event log. */
        private Path root = Path.of(".planwright");
        private Duration lockTimeout = Duration.ofSeconds(10);

        public Path getRoot() { return root; }
        public void setRoot(Path root) { this.root = root; }
        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
    }

    public static class Orchestrator {
        private int batchSize = 5;
        private int maxRetries = 3;
        private Duration stuckThreshold = Duration.ofMinutes(30);
        private Duration stuckGrace = Duration.ofMinutes(5);
        private StuckAction stuckAction = StuckAction.NONE;
        private Duration tickInterval = Duration.ofSeconds(1);
        private UncommittedChangesPolicy onUncommittedChanges = UncommittedChangesPolicy.IGNORE;
        private boolean autoCommit = false;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getStuckThreshold() { return stuckThreshold; }
        public void setStuckThreshold(Duration stuckThreshold) { this.stuckThreshold = stuckThreshold; }
        public Duration getStuckGrace() { return stuckGrace; }
        public void setStuckGrace(Duration stuckGrace) { this.stuckGrace = stuckGrace; }
        public StuckAction getStuckAction() { return stuckAction; }
        public void setStuckAction(StuckAction stuckAction) { this.stuckAction = stuckAction; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public UncommittedChangesPolicy getOnUncommittedChanges() { return onUncommittedChanges; }
        public void setOnUncommittedChanges(UncommittedChangesPolicy policy) { this.onUncommittedChanges = policy; }
        public boolean isAutoCommit() { return autoCommit; }
        public void setAutoCommit(boolean autoCommit) { this.autoCommit = autoCommit; }
    }

    public static class Events {
        private int bufferSize = 1000;
        private int subscriberQueueSize = 256;
        private long maxSegmentBytes = 8L * 1024 * 1024;

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
        public int getSubscriberQueueSize() { return subscriberQueueSize; }
        public void setSubscriberQueueSize(int subscriberQueueSize) { this.subscriberQueueSize = subscriberQueueSize; }
        public long getMaxSegmentBytes() { return maxSegmentBytes; }
        public void setMaxSegmentBytes(long maxSegmentBytes) { this.maxSegmentBytes = maxSegmentBytes; }
    }

    public static class Ipc {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 7421;
        private Duration requestTimeout = Duration.ofSeconds(5);
        private int dedupeCacheSize = 512;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public int getDedupeCacheSize() { return dedupeCacheSize; }
        public void setDedupeCacheSize(int dedupeCacheSize) { this.dedupeCacheSize = dedupeCacheSize; }
    }

    public static class Commit {
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private int recentFailures = 20;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
        public int getRecentFailures() { return recentFailures; }
        public void setRecentFailures(int recentFailures) { this.recentFailures = recentFailures; }
    }

    public static class Agent {
        /** Command line; {@code {taskId}} and {@code {prompt}} are substituted per task. */
        private String command = "claude -p {prompt}";
        private Duration timeout = Duration.ofSeconds(600);
        private Path workingDirectory = Path.of(".");

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Path getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(Path workingDirectory) { this.workingDirectory = workingDirectory; }
    }
}
