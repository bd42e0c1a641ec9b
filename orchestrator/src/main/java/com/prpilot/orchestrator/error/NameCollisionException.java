package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/**
 * Branch name already taken. Generated names are regenerated by the
 * orchestrator; a caller-fixed name makes this fatal.
 */
public class NameCollisionException extends PrFlowException {

    private final String  branchName;
    private final boolean callerFixed;

    public NameCollisionException(String branchName, boolean callerFixed) {
        super(ErrorCode.NAME_COLLISION, "Branch '" + branchName + "' already exists", false,
                callerFixed
                        ? List.of("Choose a different branch name", "Omit branchName to let the service generate one")
                        : List.of("Retry the request; a new name will be generated"),
                Map.of("branchName", branchName, "callerFixed", callerFixed));
        this.branchName  = branchName;
        this.callerFixed = callerFixed;
    }

    public String getBranchName()  { return branchName; }
    public boolean isCallerFixed() { return callerFixed; }
}
