package com.sovereign.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the standard phase list of a deployment: meta analysis, repository
 * preparation, commit, and push to the remote.
 */
public final class DeploymentPlan {

    public static final String REPO_PREP = "repo_prep";
    public static final String COMMIT = "commit";
    public static final String GITHUB_DEPLOY = "github_deploy";

    private DeploymentPlan() {}

    /**
     * The standard phases. The push phase is left out when the request has no remote.
     *
     * @param request     run parameters
     * @param traceId     trace embedded in the commit message
     * @param commitTitle first line of the commit message
     */
    public static List<Phase> standard(DeploymentRequest request, String traceId, String commitTitle) {
        var phases = new ArrayList<Phase>();
        phases.add(new MetaAnalysisPhase());
        phases.add(CommandPhase.ordered(REPO_PREP,
                CommandStep.of("git_init", "git init", "Initialize repository"),
                CommandStep.of("git_add", "git add .", "Stage files for deployment")));
        phases.add(CommandPhase.ordered(COMMIT,
                CommandStep.of("git_commit", commitCommand(commitTitle, traceId, request),
                        "Create commit with trace context")));
        if (request.remoteUrl() != null) {
            phases.add(CommandPhase.ordered(GITHUB_DEPLOY,
                    CommandStep.tolerant("add_remote", "git remote add origin " + quote(request.remoteUrl()),
                            "Register deployment remote"),
                    CommandStep.of("git_push",
                            "git branch -M " + quote(request.branch()) + " && git push -u origin " + quote(request.branch()),
                            "Push to deployment remote")));
        }
        return List.copyOf(phases);
    }

    static String commitCommand(String commitTitle, String traceId, DeploymentRequest request) {
        return "git commit -m " + quote(commitTitle)
                + " -m " + quote("Trace ID: " + traceId)
                + " -m " + quote("Deployment Context: " + request.mode().name().toLowerCase(Locale.ROOT));
    }

    /**
     * Single-quotes a value for {@code sh -c}.
     */
    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
