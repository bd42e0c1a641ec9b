package com.prpilot.orchestrator.gateway;

public record PullRequestSpec(String title, String body, String head, String base) {}
