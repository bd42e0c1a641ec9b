package com.prpilot.orchestrator.validation;

import com.prpilot.orchestrator.model.ChangeEntry;
import com.prpilot.orchestrator.model.ValidationStatus;

import java.util.List;

/**
 * Result of validating one change set.
 *
 * @param entries    copies of the input entries carrying their verdicts, same order
 * @param verdict    the worst entry verdict, or INVALID for set-level violations
 * @param violations every INVALID reason, prefixed with the path it applies to
 * @param warnings   every WARNING reason, prefixed likewise
 */
public record ValidationReport(
        List<ChangeEntry> entries,
        ValidationStatus verdict,
        List<String> violations,
        List<String> warnings
) {
    public ValidationReport {
        entries    = List.copyOf(entries);
        violations = List.copyOf(violations);
        warnings   = List.copyOf(warnings);
    }

    public boolean isInvalid() {
        return verdict == ValidationStatus.INVALID;
    }
}
