package com.filter.core.config;

import com.filter.core.kanban.ConflictPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Global (installation-wide) configuration, bound from {@code application.yml} under {@code filter}.
 * Lowest-precedence layer of the configuration merge, see {@link ConfigMerger}.
 */
@Component
@ConfigurationProperties(prefix = "filter")
public class FilterProperties {

    private String home = Path.of(System.getProperty("user.home"), ".filter").toString();
    private String workspaceRoot = "";
    private List<String> defaultStages = new ArrayList<>(List.of("planning", "in-progress", "testing", "pr", "complete"));
    private String branchTemplate = "story/{id}";
    private int lockTimeoutSeconds = 30;
    private Git git = new Git();
    private Kanban kanban = new Kanban();

    public Path homePath() {
        return Path.of(home);
    }

    /**
     * @return the configured workspace root, or {@code <home>/workspaces} when unset
     */
    public Path workspaceRootPath() {
        if (workspaceRoot == null || workspaceRoot.isBlank()) {
            return homePath().resolve("workspaces");
        }
        return Path.of(workspaceRoot);
    }

    /**
     * Expresses the global settings as the base {@link ConfigLayer}; every field is set.
     */
    public ConfigLayer asLayer() {
        return new ConfigLayer(workspaceRootPath().toString(), branchTemplate, lockTimeoutSeconds,
                git.cloneRetryCount, git.timeoutSeconds, null);
    }

    public String getHome() { return home; }
    public void setHome(String home) { this.home = home; }
    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public List<String> getDefaultStages() { return defaultStages; }
    public void setDefaultStages(List<String> defaultStages) { this.defaultStages = defaultStages; }
    public String getBranchTemplate() { return branchTemplate; }
    public void setBranchTemplate(String branchTemplate) { this.branchTemplate = branchTemplate; }
    public int getLockTimeoutSeconds() { return lockTimeoutSeconds; }
    public void setLockTimeoutSeconds(int lockTimeoutSeconds) { this.lockTimeoutSeconds = lockTimeoutSeconds; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Kanban getKanban() { return kanban; }
    public void setKanban(Kanban kanban) { this.kanban = kanban; }

    public static class Git {
        private String executable = "git";
        private int timeoutSeconds = 300;
        private int cloneRetryCount = 3;
        private long backoffBaseMillis = 500;
        private long backoffMaxMillis = 10_000;
        private int fetchMaxAgeSeconds = 300;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getCloneRetryCount() { return cloneRetryCount; }
        public void setCloneRetryCount(int cloneRetryCount) { this.cloneRetryCount = cloneRetryCount; }
        public long getBackoffBaseMillis() { return backoffBaseMillis; }
        public void setBackoffBaseMillis(long backoffBaseMillis) { this.backoffBaseMillis = backoffBaseMillis; }
        public long getBackoffMaxMillis() { return backoffMaxMillis; }
        public void setBackoffMaxMillis(long backoffMaxMillis) { this.backoffMaxMillis = backoffMaxMillis; }
        public int getFetchMaxAgeSeconds() { return fetchMaxAgeSeconds; }
        public void setFetchMaxAgeSeconds(int fetchMaxAgeSeconds) { this.fetchMaxAgeSeconds = fetchMaxAgeSeconds; }
    }

    public static class Kanban {
        private ConflictPolicy conflictPolicy = ConflictPolicy.REPAIR;

        public ConflictPolicy getConflictPolicy() { return conflictPolicy; }
        public void setConflictPolicy(ConflictPolicy conflictPolicy) { this.conflictPolicy = conflictPolicy; }
    }
}
