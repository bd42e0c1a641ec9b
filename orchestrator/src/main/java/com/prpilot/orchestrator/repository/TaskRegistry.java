package com.prpilot.orchestrator.repository;

import com.prpilot.orchestrator.model.BackgroundTask;
import org.springframework.stereotype.Repository;

@Repository
public class TaskRegistry extends InMemoryRegistry<BackgroundTask> {

    public TaskRegistry(IdGenerator ids) {
        super(ids, IdGenerator.TASK);
    }
}
