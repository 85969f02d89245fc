package tech.noetzold.verification_api.model;

import java.util.List;

public record VerificationResult(
        boolean verified,
        List<Violation> violations,
        List<ConstraintOutcome> outcomes,
        Assignment assignment,
        List<String> warnings,
        String certificateDigest,
        String inputDigest,
        String certificate,
        String certificateSignature
) {
    public VerificationResult {
        violations = List.copyOf(violations);
        outcomes = List.copyOf(outcomes);
        warnings = List.copyOf(warnings);
    }
}
