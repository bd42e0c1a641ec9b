package com.prpilot.orchestrator.model;

/**
 * Verdict for a single change entry and for a change set as a whole.
 * Ordered by severity so the aggregate is simply the maximum.
 */
public enum ValidationStatus {
    VALID,
    WARNING,   // proceeds, reported in the PR body
    INVALID;   // fails the whole request closed

    public ValidationStatus worst(ValidationStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
