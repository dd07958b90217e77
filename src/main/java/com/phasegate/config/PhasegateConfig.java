package com.phasegate.config;

import com.phasegate.agent.AgentAdapter;
import com.phasegate.agent.ClaudeCodeAdapter;
import com.phasegate.core.phases.PlanImportPhase;
import com.phasegate.core.state.JsonProjectStateStore;
import com.phasegate.core.state.ProjectStateStore;
import com.phasegate.vcs.CheckpointManager;
import com.phasegate.vcs.GitCliClient;
import com.phasegate.vcs.GitClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators of the orchestration engine that are not Spring components themselves.
 */
@Configuration
public class PhasegateConfig {

    @Bean
    public ProjectStateStore projectStateStore(PhasegateProperties properties) {
        return new JsonProjectStateStore(properties.getStatePath().resolve(JsonProjectStateStore.STATE_FILE),
                JsonProjectStateStore.defaultMapper(), properties.getProjectPath().getFileName().toString());
    }

    @Bean
    public AgentAdapter agentAdapter(PhasegateProperties properties) {
        return new ClaudeCodeAdapter(properties.getProjectPath(), properties.getAgent().getCliPath(),
                properties.getAgent().getMaxTurns());
    }

    @Bean
    public GitClient gitClient(PhasegateProperties properties) {
        return new GitCliClient(properties.getProjectPath());
    }

    @Bean
    public CheckpointManager checkpointManager(GitClient gitClient, PhasegateProperties properties) {
        PhasegateProperties.Git git = properties.getGit();
        return new CheckpointManager(gitClient, git.isEnabled(), git.isAutoCommit(), git.getBranchPrefix());
    }

    @Bean
    public PlanImportPhase planImportPhase(ProjectStateStore projectStateStore) {
        return new PlanImportPhase(projectStateStore, JsonProjectStateStore.defaultMapper());
    }

    /**
     * Local registry used when no monitoring backend contributes one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
