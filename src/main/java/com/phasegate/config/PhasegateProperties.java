package com.phasegate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "phasegate")
public class PhasegateProperties {

    private String projectDir = ".";
    private String stateDir = ".phasegate";
    private Agent agent = new Agent();
    private Git git = new Git();
    private Execution execution = new Execution();

    /** Project root the agent and git run in. */
    public Path getProjectPath() {
        return Path.of(projectDir).toAbsolutePath().normalize();
    }

    /** State directory, resolved against the project root when relative. */
    public Path getStatePath() {
        return getProjectPath().resolve(stateDir).normalize();
    }

    public Duration getTaskTimeout() {
        return Duration.ofMinutes(agent.timeoutMinutes);
    }

    public String getProjectDir() { return projectDir; }
    public void setProjectDir(String projectDir) { this.projectDir = projectDir; }
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }

    public static class Agent {
        private String cliPath = "claude";
        private int timeoutMinutes = 10;
        private int maxRetries = 2;
        private int maxTurns = 1;
        private boolean validateResults = true;

        public String getCliPath() { return cliPath; }
        public void setCliPath(String cliPath) { this.cliPath = cliPath; }
        public int getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(int timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getMaxTurns() { return maxTurns; }
        public void setMaxTurns(int maxTurns) { this.maxTurns = maxTurns; }
        public boolean isValidateResults() { return validateResults; }
        public void setValidateResults(boolean validateResults) { this.validateResults = validateResults; }
    }

    public static class Git {
        private boolean enabled = true;
        private boolean autoCommit = true;
        private String branchPrefix = "impl";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isAutoCommit() { return autoCommit; }
        public void setAutoCommit(boolean autoCommit) { this.autoCommit = autoCommit; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    }

    public static class Execution {
        private boolean stopOnFailure = true;

        public boolean isStopOnFailure() { return stopOnFailure; }
        public void setStopOnFailure(boolean stopOnFailure) { this.stopOnFailure = stopOnFailure; }
    }
}
