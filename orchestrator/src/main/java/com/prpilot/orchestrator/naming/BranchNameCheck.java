package com.prpilot.orchestrator.naming;

/**
 * Outcome of a branch name check.
 *
 * @param violated null when the name is valid
 */
public record BranchNameCheck(boolean valid, BranchRule violated) {

    static final BranchNameCheck OK = new BranchNameCheck(true, null);

    static BranchNameCheck fail(BranchRule rule) {
        return new BranchNameCheck(false, rule);
    }

    public String message() {
        return valid ? "ok" : violated.message();
    }
}
