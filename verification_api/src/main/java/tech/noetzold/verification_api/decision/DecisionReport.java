package tech.noetzold.verification_api.decision;

import tech.noetzold.verification_api.model.ConstraintOutcome;
import tech.noetzold.verification_api.model.Violation;

import java.util.List;

public record DecisionReport(List<ConstraintOutcome> outcomes, List<Violation> violations, List<String> warnings) {

    public DecisionReport {
        outcomes = List.copyOf(outcomes);
        violations = List.copyOf(violations);
        warnings = List.copyOf(warnings);
    }

    public boolean allSatisfied() {
        return outcomes.stream().allMatch(ConstraintOutcome::satisfied);
    }
}
