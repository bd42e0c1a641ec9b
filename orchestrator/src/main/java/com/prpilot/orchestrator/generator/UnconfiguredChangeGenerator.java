package com.prpilot.orchestrator.generator;

import com.prpilot.orchestrator.error.GenerationException;

import java.util.List;

/** Active when no generator provider is configured; every run fails at GenerateChanges. */
public class UnconfiguredChangeGenerator implements ChangeGenerator {

    @Override
    public List<ProposedChange> generate(GenerationRequest request) {
        throw new GenerationException(
                "No code generator is configured (set prflow.generator.provider=claude and ANTHROPIC_API_KEY)");
    }
}
