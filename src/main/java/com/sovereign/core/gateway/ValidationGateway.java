package com.sovereign.core.gateway;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.logging.SensitiveData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pre-execution gateway every externally visible action passes through.
 * <p>
 * A self-preservation pattern in the action is the only hard veto. Manipulation
 * markers and excessive complexity are recorded as warnings on an allowed
 * decision and logged; they must never block execution.
 */
@Service
public class ValidationGateway {

    private static final Logger log = LoggerFactory.getLogger(ValidationGateway.class);

    private final GatewayProperties properties;

    public ValidationGateway(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * Decides whether {@code action} may run. Deterministic for a given
     * {@code (action, intent)} and the configured pattern tables.
     *
     * @param action  the concrete action, e.g. a shell command
     * @param intent  why the action is performed
     * @param context context of the task about to act
     * @return the decision
     */
    public Decision validate(String action, String intent, ExecutionContext context) {
        String normalizedAction = normalize(action);

        for (String pattern : properties.getSelfPreservationPatterns()) {
            if (normalizedAction.contains(normalize(pattern))) {
                log.warn("Self-preservation veto for action '{}' [span: {}] (matched '{}')",
                        SensitiveData.mask(action), context.spanId(), pattern);
                return Decision.rejected(RejectionCategory.SELF_PRESERVATION,
                        "Action would harm system integrity (matched '" + pattern + "')");
            }
        }

        List<String> warnings = new ArrayList<>();
        String normalizedIntent = normalize(intent);
        for (String pattern : properties.getManipulationPatterns()) {
            String marker = normalize(pattern);
            if (normalizedAction.contains(marker) || normalizedIntent.contains(marker)) {
                warnings.add("Elevated torsion: '" + pattern + "' in action or intent");
            }
        }
        if (isOverlyComplex(action, normalizedAction)) {
            warnings.add("Complex operation (" + action.length() + " chars): low value density");
        }

        if (!warnings.isEmpty()) {
            log.warn("Proceeding with caution on '{}' [span: {}]: {}", abbreviate(SensitiveData.mask(action)), context.spanId(), warnings);
            return Decision.allowed(warnings);
        }
        return Decision.allowed();
    }

    private boolean isOverlyComplex(String action, String normalizedAction) {
        if (action == null || action.length() <= properties.getComplexityThreshold()) {
            return false;
        }
        for (String exemption : properties.getComplexityExemptions()) {
            if (normalizedAction.contains(normalize(exemption))) {
                return false;
            }
        }
        return true;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String abbreviate(String action) {
        if (action == null || action.length() <= 80) {
            return action;
        }
        return action.substring(0, 77) + "...";
    }
}
