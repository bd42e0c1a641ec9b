package com.prpilot.orchestrator.naming;

/** Git ref-name rules a branch name may violate. */
public enum BranchRule {
    BLANK("branch name must not be blank"),
    TOO_LONG("branch name must be at most " + BranchNamer.MAX_BRANCH_LENGTH + " characters"),
    WHITESPACE_OR_CONTROL("branch name must not contain whitespace or control characters"),
    FORBIDDEN_CHARACTER("branch name must not contain any of ~ ^ : ? * [ \\"),
    DOUBLE_DOT("branch name must not contain '..'"),
    REFLOG_SYNTAX("branch name must not contain '@{'"),
    AT_SIGN_ONLY("branch name must not be '@'"),
    SLASH_BOUNDARY("branch name must not start or end with '/'"),
    DOUBLE_SLASH("branch name must not contain '//'"),
    DOT_BOUNDARY("branch name must not end with '.' and no component may start with '.'"),
    LEADING_DASH("branch name must not start with '-'"),
    LOCK_SUFFIX("no component of a branch name may end with '.lock'");

    private final String message;

    BranchRule(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
