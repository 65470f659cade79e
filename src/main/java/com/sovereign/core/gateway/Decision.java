package com.sovereign.core.gateway;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ValidationGateway#validate}.
 * <p>
 * An allowed decision may carry advisory warnings; they never block the
 * action. A rejected decision always has a category and a reason.
 *
 * @param verdict  allowed or rejected
 * @param category rejection category, null when allowed
 * @param reason   human-readable rejection reason, null when allowed
 * @param warnings advisory warnings, empty when none were raised
 */
public record Decision(
    Verdict verdict,
    RejectionCategory category,
    String reason,
    List<String> warnings
) {

    public enum Verdict { ALLOWED, REJECTED }

    public Decision {
        Objects.requireNonNull(verdict, "verdict");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (verdict == Verdict.REJECTED && category == null) {
            throw new IllegalArgumentException("rejected decision requires a category");
        }
    }

    public static Decision allowed() {
        return new Decision(Verdict.ALLOWED, null, null, List.of());
    }

    public static Decision allowed(List<String> warnings) {
        return new Decision(Verdict.ALLOWED, null, null, warnings);
    }

    public static Decision rejected(RejectionCategory category, String reason) {
        return new Decision(Verdict.REJECTED, category, reason, List.of());
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOWED;
    }

    public boolean isSelfPreservationVeto() {
        return verdict == Verdict.REJECTED && category == RejectionCategory.SELF_PRESERVATION;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
