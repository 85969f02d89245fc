package tech.noetzold.verification_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "verification_records", indexes = {
        @Index(name = "idx_verification_records_expires_at", columnList = "expires_at")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "verification_id", length = 64, nullable = false, unique = true)
    private String verificationId;

    @Column(name = "ontology_name", length = 128, nullable = false)
    private String ontologyName;

    @Column(name = "ontology_version", length = 64)
    private String ontologyVersion;

    @Column(name = "verified", nullable = false)
    private boolean verified;

    @Column(name = "violation_count", nullable = false)
    private int violationCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "violations_json", columnDefinition = "jsonb")
    private JsonNode violationsJson;

    @Column(name = "input_digest", length = 64, nullable = false)
    private String inputDigest;

    @Column(name = "certificate_digest", length = 64, nullable = false)
    private String certificateDigest;

    @Column(name = "certificate_signature", length = 64)
    private String certificateSignature;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
