package tech.noetzold.verification_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.time.Instant;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationRecordResponse {
    private String verification_id;
    private String ontology_name;
    private String ontology_version;
    private boolean verified;
    private int violation_count;
    private JsonNode violations;
    private String input_digest;
    private String certificate_digest;
    private String certificate_signature;
    private Long execution_time_ms;
    private Instant created_at;
    private Instant expires_at;

    public static VerificationRecordResponse fromEntity(VerificationRecord e) {
        return VerificationRecordResponse.builder()
                .verification_id(e.getVerificationId())
                .ontology_name(e.getOntologyName())
                .ontology_version(e.getOntologyVersion())
                .verified(e.isVerified())
                .violation_count(e.getViolationCount())
                .violations(e.getViolationsJson())
                .input_digest(e.getInputDigest())
                .certificate_digest(e.getCertificateDigest())
                .certificate_signature(e.getCertificateSignature())
                .execution_time_ms(e.getExecutionTimeMs())
                .created_at(e.getCreatedAt())
                .expires_at(e.getExpiresAt())
                .build();
    }
}
