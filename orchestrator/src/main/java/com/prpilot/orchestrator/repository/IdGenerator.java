package com.prpilot.orchestrator.repository;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Single source of record ids. Ids are prefixed by kind so they are
 * recognisable in logs ("req-…", "wf-…", "task-…").
 */
@Component
public class IdGenerator {

    public static final String REQUEST  = "req";
    public static final String WORKFLOW = "wf";
    public static final String TASK     = "task";
    public static final String CHANGE   = "chg";
    public static final String ERROR    = "err";

    public String next(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
