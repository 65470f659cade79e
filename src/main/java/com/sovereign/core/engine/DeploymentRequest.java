package com.sovereign.core.engine;

import com.sovereign.core.context.ExecutionMode;

import java.util.Objects;

/**
 * Parameters of one deployment run.
 *
 * @param repoPath     local repository to deploy
 * @param remoteUrl    remote to push to, null (or blank) when only local phases run
 * @param branch       branch pushed to the remote
 * @param mode         execution mode recorded on the root context
 * @param eventLogPath JSON-lines export target, null for none
 */
public record DeploymentRequest(
    String repoPath,
    String remoteUrl,
    String branch,
    ExecutionMode mode,
    String eventLogPath
) {

    public DeploymentRequest {
        Objects.requireNonNull(repoPath, "repoPath");
        remoteUrl = remoteUrl == null || remoteUrl.isBlank() ? null : remoteUrl;
        eventLogPath = eventLogPath == null || eventLogPath.isBlank() ? null : eventLogPath;
        branch = branch == null || branch.isBlank() ? "main" : branch;
        mode = mode == null ? ExecutionMode.ARCHITECT : mode;
    }

    /**
     * Request built from the configured defaults.
     */
    public static DeploymentRequest from(EngineProperties properties, String eventLogPath) {
        return new DeploymentRequest(properties.getRepoPath(), properties.getRemoteUrl(),
                properties.getBranch(), properties.getMode(), eventLogPath);
    }
}
