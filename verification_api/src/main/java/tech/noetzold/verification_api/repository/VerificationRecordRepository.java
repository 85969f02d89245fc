package tech.noetzold.verification_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.verification_api.model.VerificationRecord;

import java.time.Instant;
import java.util.Optional;

public interface VerificationRecordRepository extends JpaRepository<VerificationRecord, Long> {
    Optional<VerificationRecord> findByVerificationId(String verificationId);

    long deleteByExpiresAtBefore(Instant cutoff);
}
