package tech.noetzold.verification_api.decision;

public class DecisionTimeoutException extends RuntimeException {

    public DecisionTimeoutException(String constraintId) {
        super("Decision budget exhausted for constraint " + constraintId);
    }
}
