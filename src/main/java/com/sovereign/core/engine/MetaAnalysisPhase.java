package com.sovereign.core.engine;

import com.sovereign.core.events.EventTypes;
import com.sovereign.core.scope.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Phase without tasks: records the concerns a plain add/commit/push workflow
 * leaves out, as an {@code analysis.concerns} event on the phase span.
 */
public class MetaAnalysisPhase implements Phase {

    private static final Logger log = LoggerFactory.getLogger(MetaAnalysisPhase.class);

    public static final String NAME = "meta_analysis";

    static final List<String> MISSING_CONCERNS = List.of(
            "Context preservation across deployments",
            "Cancellation semantics for interrupted pushes",
            "Resource cleanup for temporary files",
            "Observability of deployment causality",
            "Validation of destructive operations");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void execute(TaskScope scope, PhaseRuntime runtime) {
        log.info("Concerns missing from a traditional deployment: {}", MISSING_CONCERNS);
        runtime.eventBus().emit(EventTypes.ANALYSIS_CONCERNS, Map.of("concerns", MISSING_CONCERNS), scope.context());
    }
}
