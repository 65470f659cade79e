package com.sovereign.core.gateway;

/**
 * Why an action was rejected. Callers turn {@link #SELF_PRESERVATION} into a
 * cancellation and {@link #POLICY_OTHER} into an ordinary error.
 */
public enum RejectionCategory {
    SELF_PRESERVATION,
    POLICY_OTHER
}
