package com.planwright.config;

import com.planwright.agent.AgentRunner;
import com.planwright.agent.ProcessAgentRunner;
import com.planwright.core.commit.CommitQueue;
import com.planwright.core.metrics.PlanwrightMetrics;
import com.planwright.core.store.SnapshotReplayer;
import com.planwright.vcs.GitCliVersionControl;
import com.planwright.vcs.VersionControl;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PlanwrightConfig {

    @Bean
    @ConditionalOnMissingBean(VersionControl.class)
    public VersionControl versionControl(PlanwrightProperties properties) {
        return new GitCliVersionControl(properties.getAgent().getWorkingDirectory());
    }

    /**
     * Single commit queue for the process; state lives next to the plans so a restart
     * resumes unfinished commits.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public CommitQueue commitQueue(VersionControl versionControl, PlanwrightProperties properties,
                                   PlanwrightMetrics metrics) {
        var commit = properties.getCommit();
        return new CommitQueue(properties.getStore().getRoot().resolve("commit-queue.json"), versionControl,
                commit.getMaxAttempts(), commit.getRetryDelay(), commit.getRecentFailures(), metrics,
                Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(AgentRunner.class)
    public AgentRunner agentRunner(PlanwrightProperties properties) {
        var agent = properties.getAgent();
        return new ProcessAgentRunner(agent.getCommand(), agent.getTimeout(), agent.getWorkingDirectory());
    }

    @Bean
    public SnapshotReplayer snapshotReplayer() {
        return new SnapshotReplayer();
    }
}
