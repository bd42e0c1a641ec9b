package com.prpilot.orchestrator.gateway;

/**
 * @param reusedExisting true when an open PR for the same head and base was
 *                       found instead of a new one being opened
 */
public record PullRequestInfo(int number, String url, String head, String base, boolean reusedExisting) {}
