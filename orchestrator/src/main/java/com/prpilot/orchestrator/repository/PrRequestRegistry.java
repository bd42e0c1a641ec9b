package com.prpilot.orchestrator.repository;

import com.prpilot.orchestrator.model.PrRequest;
import org.springframework.stereotype.Repository;

@Repository
public class PrRequestRegistry extends InMemoryRegistry<PrRequest> {

    public PrRequestRegistry(IdGenerator ids) {
        super(ids, IdGenerator.REQUEST);
    }
}
