package tech.noetzold.verification_api.model;

public record ConstraintOutcome(String constraintId, Verdict verdict) {

    public boolean satisfied() {
        return verdict == Verdict.SATISFIED;
    }
}
