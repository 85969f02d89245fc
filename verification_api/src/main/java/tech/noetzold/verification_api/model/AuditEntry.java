package tech.noetzold.verification_api.model;

import java.time.Instant;
import java.util.List;

/**
 * What gets appended to the audit sink for one verification.
 */
public record AuditEntry(
        String verificationId,
        String ontologyName,
        String ontologyVersion,
        boolean verified,
        List<Violation> violations,
        String inputDigest,
        String certificateDigest,
        String certificateSignature,
        long executionTimeMs,
        Instant createdAt
) {
    public AuditEntry {
        violations = List.copyOf(violations);
    }
}
