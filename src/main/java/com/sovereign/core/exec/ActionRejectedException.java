package com.sovereign.core.exec;

import com.sovereign.core.gateway.RejectionCategory;

/**
 * The gateway rejected an action for a reason other than self-preservation.
 * Unlike a self-preservation veto this is a failure of the calling task.
 */
public class ActionRejectedException extends RuntimeException {

    private final RejectionCategory category;

    public ActionRejectedException(RejectionCategory category, String message) {
        super(message);
        this.category = category;
    }

    public RejectionCategory category() {
        return category;
    }
}
