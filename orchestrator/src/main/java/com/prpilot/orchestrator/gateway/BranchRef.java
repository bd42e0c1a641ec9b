package com.prpilot.orchestrator.gateway;

/** A branch on the remote and the commit it points at. */
public record BranchRef(String name, String sha) {}
