package com.prpilot.orchestrator.generator;

import java.util.List;

/**
 * Turns a free-text request plus analysed repository context into proposed
 * file operations. Treated as opaque by the orchestrator.
 */
public interface ChangeGenerator {

    /**
     * @return the proposed changes; never null
     * @throws com.prpilot.orchestrator.error.GenerationException if nothing usable was produced
     */
    List<ProposedChange> generate(GenerationRequest request);
}
