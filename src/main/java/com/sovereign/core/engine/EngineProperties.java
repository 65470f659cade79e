package com.sovereign.core.engine;

import com.sovereign.core.context.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for deployment runs; every value can be overridden per run from the CLI.
 */
@Component
@ConfigurationProperties(prefix = "sovereign.engine")
public class EngineProperties {

    private String repoPath = ".";
    private String remoteUrl;
    private String branch = "main";
    private ExecutionMode mode = ExecutionMode.ARCHITECT;
    /** Per-phase deadline; 0 disables it. */
    private int phaseTimeoutSeconds = 0;
    private String commitTitle = "Sovereign deployment";

    public String getRepoPath() { return repoPath; }
    public void setRepoPath(String repoPath) { this.repoPath = repoPath; }
    public String getRemoteUrl() { return remoteUrl; }
    public void setRemoteUrl(String remoteUrl) { this.remoteUrl = remoteUrl; }
    public String getBranch() { return branch; }
    public void setBranch(String branch) { this.branch = branch; }
    public ExecutionMode getMode() { return mode; }
    public void setMode(ExecutionMode mode) { this.mode = mode; }
    public int getPhaseTimeoutSeconds() { return phaseTimeoutSeconds; }
    public void setPhaseTimeoutSeconds(int phaseTimeoutSeconds) { this.phaseTimeoutSeconds = phaseTimeoutSeconds; }
    public String getCommitTitle() { return commitTitle; }
    public void setCommitTitle(String commitTitle) { this.commitTitle = commitTitle; }
}
